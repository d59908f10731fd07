/**
 * Domain layer: the simulated business logic the demo handlers wrap in spans.
 *
 * <ul>
 *   <li>{@link com.stratus.demofunction.domain.DemoOperations} is the port to the downstream
 *       services (table store, object store, external API)
 *   <li>{@link com.stratus.demofunction.domain.SimulatedOperations} stands in for them with
 *       sleeps and optional failure injection
 *   <li>{@link com.stratus.demofunction.domain.BusinessLogic} orchestrates the operations and
 *       records their spans, logs and metrics
 * </ul>
 *
 * <p>Domain MUST NOT depend on the api, config or infrastructure packages.
 */
package com.stratus.demofunction.domain;
