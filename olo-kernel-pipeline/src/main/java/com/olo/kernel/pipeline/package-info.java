/**
 * Pipeline configuration consumed by the orchestrator.
 *
 * <ul>
 *   <li>{@link com.olo.kernel.pipeline.PipelineConfig} – stages, bounds, edge limits; {@code validate()} and
 *       {@code getReadyStages()} for DAG execution</li>
 *   <li>{@link com.olo.kernel.pipeline.AgentConfig} – one stage with its routing
 *       ({@link com.olo.kernel.pipeline.RoutingRule}, default/error next) and dependencies</li>
 *   <li>{@link com.olo.kernel.pipeline.PipelineConfigJson} – {@code fromJson}/{@code fromMap}/{@code toJson}</li>
 * </ul>
 */
package com.olo.kernel.pipeline;
