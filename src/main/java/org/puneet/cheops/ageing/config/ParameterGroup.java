package org.puneet.cheops.ageing.config;

import java.util.List;
import java.util.Objects;

/**
 * Named group of parameters that are presented together, e.g. "Position" with XC and YC.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ParameterGroup {

    private final String name;
    private final List<String> parameters;

    private ParameterGroup(String name, List<String> parameters) {
        this.name = Objects.requireNonNull(name, "Group name cannot be null");
        this.parameters = List.copyOf(parameters);
        if (this.parameters.isEmpty()) {
            throw new IllegalArgumentException("Parameter group '" + name + "' must list at least one parameter");
        }
    }

    public static ParameterGroup of(String name, String... parameters) {
        return new ParameterGroup(name, List.of(parameters));
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public boolean contains(String parameter) {
        return parameters.contains(parameter);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ParameterGroup that = (ParameterGroup) obj;
        return name.equals(that.name) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters);
    }

    @Override
    public String toString() {
        return name + parameters;
    }
}
