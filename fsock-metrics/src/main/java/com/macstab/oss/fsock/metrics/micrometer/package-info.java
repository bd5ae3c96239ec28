/* (C)2026 Macstab GmbH */
/**
 * Micrometer binding for {@link com.macstab.oss.fsock.metrics.EventSocketMetrics}.
 *
 * <p>{@link com.macstab.oss.fsock.metrics.micrometer.MicrometerEventSocketMetrics} records
 * counters and pool gauges under the {@code fsock.*} names listed in {@link
 * com.macstab.oss.fsock.metrics.micrometer.MetricsConfiguration}.
 */
package com.macstab.oss.fsock.metrics.micrometer;
