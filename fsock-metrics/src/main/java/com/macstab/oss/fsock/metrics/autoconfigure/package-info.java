/* (C)2026 Macstab GmbH */
/**
 * Spring Boot auto-configuration for event socket metrics ({@code management.metrics.fsock.*}).
 */
package com.macstab.oss.fsock.metrics.autoconfigure;
