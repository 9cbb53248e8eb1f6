/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.nodalanalysis;

import com.google.common.collect.ImmutableMap;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.config.PlatformConfig;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Tuning of a nodal analysis run. Defaults can be overridden by the {@value #MODULE_NAME} platform config module.
 *
 * @author PowSyBl nodal analysis developers
 */
public class NodalAnalysisParameters {

    public static final String MODULE_NAME = "nodal-analysis-default-parameters";

    public static final List<String> REFERENCE_NODE_ALIASES_DEFAULT_VALUE = List.of("GND", "0");

    /** Maximum absolute residual of G.V - I for a solution to be considered verified **/
    public static final double RESIDUAL_TOLERANCE_DEFAULT_VALUE = 1e-9;

    /** Maximum power imbalance, relative to the sum of absolute component powers (floored at 1 W) **/
    public static final double POWER_BALANCE_TOLERANCE_DEFAULT_VALUE = 1e-9;

    public static final double SOURCE_CONSISTENCY_TOLERANCE_DEFAULT_VALUE = 1e-9;

    public static final int MAX_COMPONENT_COUNT_DEFAULT_VALUE = 200;

    public static final int SIGNIFICANT_DIGITS_DEFAULT_VALUE = 6;

    public static final String REFERENCE_NODE_ALIASES_PARAM_NAME = "referenceNodeAliases";

    public static final String RESIDUAL_TOLERANCE_PARAM_NAME = "residualTolerance";

    public static final String POWER_BALANCE_TOLERANCE_PARAM_NAME = "powerBalanceTolerance";

    public static final String SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME = "sourceConsistencyTolerance";

    public static final String MAX_COMPONENT_COUNT_PARAM_NAME = "maxComponentCount";

    public static final String SIGNIFICANT_DIGITS_PARAM_NAME = "significantDigits";

    public static final List<String> PARAMETERS_NAMES = List.of(REFERENCE_NODE_ALIASES_PARAM_NAME,
                                                                RESIDUAL_TOLERANCE_PARAM_NAME,
                                                                POWER_BALANCE_TOLERANCE_PARAM_NAME,
                                                                SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME,
                                                                MAX_COMPONENT_COUNT_PARAM_NAME,
                                                                SIGNIFICANT_DIGITS_PARAM_NAME);

    private List<String> referenceNodeAliases = REFERENCE_NODE_ALIASES_DEFAULT_VALUE;

    private double residualTolerance = RESIDUAL_TOLERANCE_DEFAULT_VALUE;

    private double powerBalanceTolerance = POWER_BALANCE_TOLERANCE_DEFAULT_VALUE;

    private double sourceConsistencyTolerance = SOURCE_CONSISTENCY_TOLERANCE_DEFAULT_VALUE;

    private int maxComponentCount = MAX_COMPONENT_COUNT_DEFAULT_VALUE;

    private int significantDigits = SIGNIFICANT_DIGITS_DEFAULT_VALUE;

    public List<String> getReferenceNodeAliases() {
        return referenceNodeAliases;
    }

    public NodalAnalysisParameters setReferenceNodeAliases(List<String> referenceNodeAliases) {
        Objects.requireNonNull(referenceNodeAliases);
        if (referenceNodeAliases.isEmpty()) {
            throw new PowsyblException("At least one reference node alias is required");
        }
        for (String alias : referenceNodeAliases) {
            if (alias == null || alias.isBlank()) {
                throw new PowsyblException("Invalid reference node alias: '" + alias + "'");
            }
        }
        this.referenceNodeAliases = referenceNodeAliases.stream().map(String::trim).toList();
        return this;
    }

    /**
     * Label used to report the reference node, whatever alias the input used.
     */
    public String getReferenceNodeLabel() {
        return referenceNodeAliases.get(0);
    }

    public boolean isReferenceNode(String label) {
        String trimmed = label.trim();
        return referenceNodeAliases.stream().anyMatch(alias -> alias.equalsIgnoreCase(trimmed));
    }

    public double getResidualTolerance() {
        return residualTolerance;
    }

    public NodalAnalysisParameters setResidualTolerance(double residualTolerance) {
        this.residualTolerance = checkTolerance(residualTolerance, RESIDUAL_TOLERANCE_PARAM_NAME);
        return this;
    }

    public double getPowerBalanceTolerance() {
        return powerBalanceTolerance;
    }

    public NodalAnalysisParameters setPowerBalanceTolerance(double powerBalanceTolerance) {
        this.powerBalanceTolerance = checkTolerance(powerBalanceTolerance, POWER_BALANCE_TOLERANCE_PARAM_NAME);
        return this;
    }

    public double getSourceConsistencyTolerance() {
        return sourceConsistencyTolerance;
    }

    public NodalAnalysisParameters setSourceConsistencyTolerance(double sourceConsistencyTolerance) {
        this.sourceConsistencyTolerance = checkTolerance(sourceConsistencyTolerance, SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME);
        return this;
    }

    public int getMaxComponentCount() {
        return maxComponentCount;
    }

    public NodalAnalysisParameters setMaxComponentCount(int maxComponentCount) {
        if (maxComponentCount < 1) {
            throw new PowsyblException("Invalid max component count value: " + maxComponentCount);
        }
        this.maxComponentCount = maxComponentCount;
        return this;
    }

    public int getSignificantDigits() {
        return significantDigits;
    }

    public NodalAnalysisParameters setSignificantDigits(int significantDigits) {
        if (significantDigits < 1 || significantDigits > 17) {
            throw new PowsyblException("Invalid significant digits value: " + significantDigits);
        }
        this.significantDigits = significantDigits;
        return this;
    }

    private static double checkTolerance(double tolerance, String name) {
        if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
            throw new PowsyblException("Invalid " + name + " value: " + tolerance);
        }
        return tolerance;
    }

    public static NodalAnalysisParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static NodalAnalysisParameters load(PlatformConfig platformConfig) {
        NodalAnalysisParameters parameters = new NodalAnalysisParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setReferenceNodeAliases(config.getStringListProperty(REFERENCE_NODE_ALIASES_PARAM_NAME, REFERENCE_NODE_ALIASES_DEFAULT_VALUE))
                .setResidualTolerance(config.getDoubleProperty(RESIDUAL_TOLERANCE_PARAM_NAME, RESIDUAL_TOLERANCE_DEFAULT_VALUE))
                .setPowerBalanceTolerance(config.getDoubleProperty(POWER_BALANCE_TOLERANCE_PARAM_NAME, POWER_BALANCE_TOLERANCE_DEFAULT_VALUE))
                .setSourceConsistencyTolerance(config.getDoubleProperty(SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME, SOURCE_CONSISTENCY_TOLERANCE_DEFAULT_VALUE))
                .setMaxComponentCount(config.getIntProperty(MAX_COMPONENT_COUNT_PARAM_NAME, MAX_COMPONENT_COUNT_DEFAULT_VALUE))
                .setSignificantDigits(config.getIntProperty(SIGNIFICANT_DIGITS_PARAM_NAME, SIGNIFICANT_DIGITS_DEFAULT_VALUE)));
        return parameters;
    }

    /**
     * Independent copy, later changes to either instance do not affect the other.
     */
    public NodalAnalysisParameters copy() {
        return new NodalAnalysisParameters()
                .setReferenceNodeAliases(referenceNodeAliases)
                .setResidualTolerance(residualTolerance)
                .setPowerBalanceTolerance(powerBalanceTolerance)
                .setSourceConsistencyTolerance(sourceConsistencyTolerance)
                .setMaxComponentCount(maxComponentCount)
                .setSignificantDigits(significantDigits);
    }

    public static NodalAnalysisParameters load(Map<String, String> properties) {
        return new NodalAnalysisParameters().update(properties);
    }

    private static List<String> parseStringListProp(String prop) {
        if (prop.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(prop.split("[:,]"));
    }

    public NodalAnalysisParameters update(Map<String, String> properties) {
        for (String name : properties.keySet()) {
            if (!PARAMETERS_NAMES.contains(name)) {
                throw new PowsyblException("Unknown nodal analysis parameter: '" + name + "'");
            }
        }
        Optional.ofNullable(properties.get(REFERENCE_NODE_ALIASES_PARAM_NAME))
                .ifPresent(prop -> this.setReferenceNodeAliases(parseStringListProp(prop)));
        Optional.ofNullable(properties.get(RESIDUAL_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setResidualTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(POWER_BALANCE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setPowerBalanceTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setSourceConsistencyTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(MAX_COMPONENT_COUNT_PARAM_NAME))
                .ifPresent(prop -> this.setMaxComponentCount(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(SIGNIFICANT_DIGITS_PARAM_NAME))
                .ifPresent(prop -> this.setSignificantDigits(Integer.parseInt(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        return ImmutableMap.<String, Object>builder()
                .put(REFERENCE_NODE_ALIASES_PARAM_NAME, referenceNodeAliases)
                .put(RESIDUAL_TOLERANCE_PARAM_NAME, residualTolerance)
                .put(POWER_BALANCE_TOLERANCE_PARAM_NAME, powerBalanceTolerance)
                .put(SOURCE_CONSISTENCY_TOLERANCE_PARAM_NAME, sourceConsistencyTolerance)
                .put(MAX_COMPONENT_COUNT_PARAM_NAME, maxComponentCount)
                .put(SIGNIFICANT_DIGITS_PARAM_NAME, significantDigits)
                .build();
    }

    @Override
    public String toString() {
        return "NodalAnalysisParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}
