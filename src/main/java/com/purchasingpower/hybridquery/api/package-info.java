/**
 * REST surface of the query engine.
 *
 * <ul>
 *   <li>{@code POST /api/v1/query} - plan and execute, returns matched objects and execution errors</li>
 *   <li>{@code POST /api/v1/query/plan} - plan only, returns the planned tree</li>
 * </ul>
 *
 * <p>Planning problems map to 400 with every problem listed in {@code errors}.
 */
package com.purchasingpower.hybridquery.api;
