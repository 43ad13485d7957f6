/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Viewstream.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewstream.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Health-check summary: the issues observed and what to do about them.
 *
 * @author hal.hildebrand
 */
public record HealthStatus(List<String> issues, List<String> recommendations) {

    public HealthStatus {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public static HealthStatus healthy() {
        return new HealthStatus(List.of(), List.of());
    }

    public boolean isHealthy() {
        return issues.isEmpty();
    }

    /**
     * Merge with another summary, keeping this summary's entries first.
     */
    public HealthStatus combine(HealthStatus other) {
        var mergedIssues = new ArrayList<>(issues);
        mergedIssues.addAll(other.issues);
        var mergedRecommendations = new ArrayList<>(recommendations);
        for (var recommendation : other.recommendations) {
            if (!mergedRecommendations.contains(recommendation)) {
                mergedRecommendations.add(recommendation);
            }
        }
        return new HealthStatus(mergedIssues, mergedRecommendations);
    }

    /**
     * Accumulates issues and recommendations.
     */
    public static class Builder {
        private final List<String> issues          = new ArrayList<>();
        private final List<String> recommendations = new ArrayList<>();

        public Builder issue(String issue, String recommendation) {
            issues.add(issue);
            if (recommendation != null && !recommendations.contains(recommendation)) {
                recommendations.add(recommendation);
            }
            return this;
        }

        public HealthStatus build() {
            return new HealthStatus(issues, recommendations);
        }
    }
}
