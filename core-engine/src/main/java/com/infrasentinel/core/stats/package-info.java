/**
 * Statistics kept by the detection engine.
 *
 * <ul>
 * <li>{@link com.infrasentinel.core.stats.GlobalStatsAccumulator} fits
 * immutable {@link com.infrasentinel.core.stats.GlobalStats} from a baseline
 * dataset, once</li>
 * <li>{@link com.infrasentinel.core.stats.RollingWindow} holds the recent
 * history of one metric with O(1) mean and standard deviation</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.infrasentinel.core.stats;
