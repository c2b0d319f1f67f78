/**
 * Configuration loading, validation and wiring for the WARDEN commands.
 *
 * <p>{@link ca.gc.cra.warden.config.YamlConfigLoader} and {@link ca.gc.cra.warden.config.ConfigMerger} produce a flat
 * map that {@link ca.gc.cra.warden.config.EngineConfig} validates; {@link ca.gc.cra.warden.config.CompositionRoot}
 * turns the result into running components.</p>
 */
package ca.gc.cra.warden.config;
