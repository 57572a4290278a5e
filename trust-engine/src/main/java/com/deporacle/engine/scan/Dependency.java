package com.deporacle.engine.scan;

import com.deporacle.engine.model.Ecosystem;

/**
 * A resolved dependency of a project.
 *
 * @author Naveed Gung
 */
public record Dependency(String name, String version, boolean isDirect, Ecosystem ecosystem) {
}
