package com.purchasingpower.emsflow.tool.schema;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Parameter schemas for automation rules, conditions and actions.
 *
 * <p>Conditions and actions carry a type-specific {@code parameters} object; the
 * variant is selected by the sibling {@code condition_type} / {@code action_type}.
 */
public final class AutomationSchemas {

    public static final double MIN_FREQUENCY_MHZ = 10.0;
    public static final double MAX_FREQUENCY_MHZ = 6000.0;
    public static final double MIN_THRESHOLD_DBM = -150.0;
    public static final double MAX_THRESHOLD_DBM = 150.0;

    public static final String SIGNAL_DETECTION = "signalDetection";
    public static final String SPECTRAL_ENERGY = "spectralEnergy";
    public static final String FREQUENCY_SCAN_REQUEST = "frequencyScanRequest";
    public static final String GEOLOCATION_REQUEST = "geolocationRequest";
    public static final String USER_NOTIFICATION = "userNotification";

    public static final List<String> CONDITION_TYPES = List.of(SIGNAL_DETECTION, SPECTRAL_ENERGY);
    public static final List<String> ACTION_TYPES = List.of(
            FREQUENCY_SCAN_REQUEST, GEOLOCATION_REQUEST, USER_NOTIFICATION);
    public static final List<String> SIGNAL_TYPES = List.of(
            "Energy", "5G", "LTE", "QPSK", "CW", "PCMPM", "CPM", "CPMFM", "BPSK", "SOQPSK");
    public static final List<String> GEOLOCATION_ALGORITHMS = List.of("TDOA", "PDOA");

    // ================================================================
    // SCALAR FIELDS
    // ================================================================

    public static final ParameterSpec RULE_ID = ParameterSpec.builder()
            .name("rule_id").type(ParameterType.STRING).required(true).nonBlank(true)
            .description("identifier of an existing rule, e.g. rule-001")
            .build();

    private static final ParameterSpec MIN_FREQUENCY = ParameterSpec.builder()
            .name("minFrequencyMHz").type(ParameterType.NUMBER)
            .min(MIN_FREQUENCY_MHZ).max(MAX_FREQUENCY_MHZ).defaultValue(MIN_FREQUENCY_MHZ)
            .description("lower bound of the monitored band")
            .build();

    private static final ParameterSpec MAX_FREQUENCY = ParameterSpec.builder()
            .name("maxFrequencyMHz").type(ParameterType.NUMBER)
            .min(MIN_FREQUENCY_MHZ).max(MAX_FREQUENCY_MHZ).defaultValue(MAX_FREQUENCY_MHZ)
            .description("upper bound of the monitored band")
            .build();

    private static final ParameterSpec SIGNAL_TYPE = ParameterSpec.builder()
            .name("signalType").type(ParameterType.STRING).required(true)
            .allowedValues(SIGNAL_TYPES)
            .build();

    private static final ParameterSpec THRESHOLD = ParameterSpec.builder()
            .name("threshold_dBm").type(ParameterType.NUMBER).required(true)
            .min(MIN_THRESHOLD_DBM).max(MAX_THRESHOLD_DBM)
            .description("energy threshold in dBm")
            .build();

    private static final ParameterSpec SCAN_SENSORS = ParameterSpec.builder()
            .name("sensorIds").type(ParameterType.STRING_LIST).required(true).minItems(1)
            .build();

    private static final ParameterSpec GEOLOCATION_SENSORS = SCAN_SENSORS.toBuilder().minItems(2).build();

    private static final ParameterSpec ALGORITHM = ParameterSpec.builder()
            .name("algorithm").type(ParameterType.STRING).required(true)
            .allowedValues(GEOLOCATION_ALGORITHMS)
            .build();

    private static final ParameterSpec MESSAGE = ParameterSpec.builder()
            .name("message").type(ParameterType.STRING).required(true).nonBlank(true)
            .description("notification text shown to the operator")
            .build();

    // ================================================================
    // PARAMETER VARIANTS
    // ================================================================

    private static final CrossFieldRule FREQUENCY_ORDER =
            CrossFieldRule.lessThan("minFrequencyMHz", "maxFrequencyMHz");

    private static final Map<String, ParameterSchema> CONDITION_VARIANTS = new TreeMap<>(Map.of(
            SIGNAL_DETECTION, ParameterSchema.builder()
                    .field(SIGNAL_TYPE).field(MIN_FREQUENCY).field(MAX_FREQUENCY)
                    .rule(FREQUENCY_ORDER)
                    .build(),
            SPECTRAL_ENERGY, ParameterSchema.builder()
                    .field(THRESHOLD).field(MIN_FREQUENCY).field(MAX_FREQUENCY)
                    .rule(FREQUENCY_ORDER)
                    .build()));

    private static final ParameterSchema ANY_CONDITION = ParameterSchema.builder()
            .field(SIGNAL_TYPE).field(THRESHOLD).field(MIN_FREQUENCY).field(MAX_FREQUENCY)
            .rule(FREQUENCY_ORDER)
            .build()
            .partial();

    private static final Map<String, ParameterSchema> ACTION_VARIANTS = new TreeMap<>(Map.of(
            FREQUENCY_SCAN_REQUEST, ParameterSchema.builder().field(SCAN_SENSORS).build(),
            GEOLOCATION_REQUEST, ParameterSchema.builder().field(ALGORITHM).field(GEOLOCATION_SENSORS).build(),
            USER_NOTIFICATION, ParameterSchema.builder().field(MESSAGE).build()));

    private static final ParameterSchema ANY_ACTION = ParameterSchema.builder()
            .field(MESSAGE).field(SCAN_SENSORS).field(ALGORITHM)
            .build()
            .partial();

    // ================================================================
    // FIELD GROUPS
    // ================================================================

    public static final List<ParameterSpec> RULE_FIELDS = List.of(
            ParameterSpec.builder().name("name").type(ParameterType.STRING).required(true).nonBlank(true)
                    .description("short descriptive rule name").build(),
            ParameterSpec.builder().name("description").type(ParameterType.STRING)
                    .description("what the rule does").build(),
            ParameterSpec.builder().name("is_enabled").type(ParameterType.BOOLEAN).defaultValue(Boolean.FALSE)
                    .description("activate immediately").build(),
            ParameterSpec.builder().name("max_executions").type(ParameterType.INTEGER).min(1.0)
                    .description("limit on how many times the rule may fire").build(),
            ParameterSpec.builder().name("start_time").type(ParameterType.DATETIME)
                    .description("ISO-8601 start of the active window").build(),
            ParameterSpec.builder().name("end_time").type(ParameterType.DATETIME)
                    .description("ISO-8601 end of the active window").build());

    public static final CrossFieldRule RULE_WINDOW = CrossFieldRule.before("start_time", "end_time");

    public static final List<ParameterSpec> CONDITION_FIELDS = List.of(
            ParameterSpec.builder().name("condition_type").type(ParameterType.STRING).required(true)
                    .allowedValues(CONDITION_TYPES).build(),
            conditionParametersSpec("condition_parameters", "condition_type").toBuilder().required(true).build(),
            ParameterSpec.builder().name("condition_description").type(ParameterType.STRING).build());

    public static final List<ParameterSpec> ACTION_FIELDS = List.of(
            ParameterSpec.builder().name("action_type").type(ParameterType.STRING).required(true)
                    .allowedValues(ACTION_TYPES).build(),
            actionParametersSpec("action_parameters", "action_type").toBuilder().required(true).build(),
            ParameterSpec.builder().name("action_description").type(ParameterType.STRING).build());

    private AutomationSchemas() {
    }

    // ================================================================
    // TOOL SCHEMAS
    // ================================================================

    public static ParameterSchema ruleIdOnly() {
        return ParameterSchema.builder().field(RULE_ID).build();
    }

    public static ParameterSchema rule(List<ParameterSpec> extraFields) {
        return ParameterSchema.builder()
                .fields(RULE_FIELDS)
                .fields(extraFields)
                .rule(RULE_WINDOW)
                .build();
    }

    public static ParameterSchema conditionUpdate() {
        return ParameterSchema.builder()
                .field(RULE_ID)
                .field(ParameterSpec.builder().name("condition_id").type(ParameterType.STRING)
                        .description("defaults to the rule's first condition").build())
                .field(ParameterSpec.builder().name("condition_type").type(ParameterType.STRING)
                        .allowedValues(CONDITION_TYPES).build())
                .field(conditionParametersSpec("parameters", "condition_type").relaxed())
                .field(ParameterSpec.builder().name("description").type(ParameterType.STRING).build())
                .build();
    }

    public static ParameterSchema actionUpdate() {
        return ParameterSchema.builder()
                .field(RULE_ID)
                .field(ParameterSpec.builder().name("action_id").type(ParameterType.STRING)
                        .description("defaults to the rule's first action").build())
                .field(ParameterSpec.builder().name("action_type").type(ParameterType.STRING)
                        .allowedValues(ACTION_TYPES).build())
                .field(actionParametersSpec("parameters", "action_type").relaxed())
                .field(ParameterSpec.builder().name("description").type(ParameterType.STRING).build())
                .build();
    }

    /**
     * Full schema of a condition's parameters for the given type.
     */
    public static Optional<ParameterSchema> conditionParameters(String conditionType) {
        return Optional.ofNullable(conditionType).map(CONDITION_VARIANTS::get);
    }

    /**
     * Full schema of an action's parameters for the given type.
     */
    public static Optional<ParameterSchema> actionParameters(String actionType) {
        return Optional.ofNullable(actionType).map(ACTION_VARIANTS::get);
    }

    private static ParameterSpec conditionParametersSpec(String name, String discriminator) {
        return ParameterSpec.builder()
                .name(name).type(ParameterType.OBJECT)
                .discriminator(discriminator)
                .variants(CONDITION_VARIANTS)
                .fallback(ANY_CONDITION)
                .description("condition-specific parameters")
                .build();
    }

    private static ParameterSpec actionParametersSpec(String name, String discriminator) {
        return ParameterSpec.builder()
                .name(name).type(ParameterType.OBJECT)
                .discriminator(discriminator)
                .variants(ACTION_VARIANTS)
                .fallback(ANY_ACTION)
                .description("action-specific parameters")
                .build();
    }
}
