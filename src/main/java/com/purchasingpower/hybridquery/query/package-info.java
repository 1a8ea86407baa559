/**
 * Logical query model.
 *
 * <p>A {@link com.purchasingpower.hybridquery.query.ComplexQuery} holds a tree of
 * {@link com.purchasingpower.hybridquery.query.QueryClause} nodes:
 * <ul>
 *   <li>{@code QueryComponent} - leaf conditions on one object type</li>
 *   <li>{@code LogicalGroup} - AND / OR over child clauses</li>
 *   <li>{@code NotClause} - complement within the object type's extent</li>
 * </ul>
 *
 * <p>All clause classes are immutable and deserialize from JSON with a
 * {@code type} discriminator ({@code component}, {@code group}, {@code not}).
 *
 * @since 1.0.0
 */
package com.purchasingpower.hybridquery.query;
