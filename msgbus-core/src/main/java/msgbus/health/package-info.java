/**
 * Three-level health status derived from windowed bus statistics.
 */
package msgbus.health;
