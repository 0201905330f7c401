package batchkeeper.coordinator.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Site-wide additions to every generated batch script.
 *
 * @param extraDirectives scheduler directives appended after the generated block
 * @param modules         environment modules loaded before the command
 * @param env             variables exported before the job's own environment
 * @param pbsStyle        how PBS resource requests are spelled
 */
public record BackendSettings(
        List<String> extraDirectives,
        List<String> modules,
        Map<String, String> env,
        PbsResourceStyle pbsStyle) {

    /**
     * PBS Pro uses {@code select=}, Torque uses {@code nodes=...:ppn=}.
     */
    public enum PbsResourceStyle {
        SELECT,
        NODES
    }

    public BackendSettings {
        extraDirectives = extraDirectives != null ? List.copyOf(extraDirectives) : List.of();
        modules = modules != null ? List.copyOf(modules) : List.of();
        env = env != null ? Collections.unmodifiableMap(new LinkedHashMap<>(env)) : Map.of();
        pbsStyle = pbsStyle != null ? pbsStyle : PbsResourceStyle.SELECT;
    }

    public static BackendSettings defaults() {
        return new BackendSettings(List.of(), List.of(), Map.of(), PbsResourceStyle.SELECT);
    }
}
