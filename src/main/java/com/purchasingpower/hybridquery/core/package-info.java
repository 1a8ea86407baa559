/**
 * Core domain models: schema definitions and object instances.
 *
 * <p>These types are shared by the clause model, the planner, the executor and
 * every store adapter. They carry no behaviour beyond simple lookups.
 *
 * @since 1.0.0
 */
package com.purchasingpower.hybridquery.core;
