package org.Aayush.alns.config;

import lombok.experimental.UtilityClass;
import org.Aayush.alns.acceptance.MainTerminationCriterion;
import org.Aayush.alns.acceptance.RecordToRecordTravelConfig;
import org.Aayush.alns.core.AlgorithmParams;
import org.Aayush.alns.core.AlnsException;
import org.apache.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.DoublePredicate;

/**
 * Loads ALNS parameters from a JSON document.
 *
 * <p>Layout:</p>
 * <pre>
 * {
 *   "scores": {
 *     "score_decay": 0.9,
 *     "new_best_multiplier": 10.0,
 *     "new_improving_multiplier": 4.0,
 *     "new_accepted_multiplier": 1.5
 *   },
 *   "acceptance": {
 *     "main_termination_criterion": "iterations",
 *     "start_threshold": 0.1,
 *     "end_threshold": 0.0
 *   },
 *   "iterations_limit": 1000000,
 *   "time_limit": 3600
 * }
 * </pre>
 *
 * <p>Every key is optional. A missing, malformed or out-of-range value falls back to its
 * documented default instead of failing the load; only an unreadable file or a document
 * that is not a JSON object is an error.</p>
 */
@UtilityClass
public final class AlnsConfigLoader {
    public static final String SECTION_SCORES = "scores";
    public static final String SECTION_ACCEPTANCE = "acceptance";

    public static final String KEY_SCORE_DECAY = "score_decay";
    public static final String KEY_NEW_BEST_MULTIPLIER = "new_best_multiplier";
    public static final String KEY_NEW_IMPROVING_MULTIPLIER = "new_improving_multiplier";
    public static final String KEY_NEW_ACCEPTED_MULTIPLIER = "new_accepted_multiplier";
    public static final String KEY_MAIN_TERMINATION_CRITERION = "main_termination_criterion";
    public static final String KEY_START_THRESHOLD = "start_threshold";
    public static final String KEY_END_THRESHOLD = "end_threshold";
    public static final String KEY_ITERATIONS_LIMIT = "iterations_limit";
    public static final String KEY_TIME_LIMIT = "time_limit";

    private static final Logger LOG = Logger.getLogger(AlnsConfigLoader.class);

    private static final DoublePredicate OPEN_UNIT_INTERVAL = value -> value > 0.0d && value < 1.0d;
    private static final DoublePredicate FINITE_POSITIVE = value -> Double.isFinite(value) && value > 0.0d;
    private static final DoublePredicate FINITE_NON_NEGATIVE = value -> Double.isFinite(value) && value >= 0.0d;

    /**
     * Reads score parameters from a JSON file.
     *
     * @param file JSON file.
     * @return parameters with defaults for missing or malformed keys.
     */
    public static AlgorithmParams loadParams(Path file) {
        return paramsFrom(readDocument(file));
    }

    /**
     * Parses score parameters from JSON text.
     */
    public static AlgorithmParams parseParams(String json) {
        return paramsFrom(parseDocument(json));
    }

    /**
     * Reads record-to-record travel settings from a JSON file.
     *
     * @param file JSON file.
     * @return configuration with defaults for missing or malformed keys.
     */
    public static RecordToRecordTravelConfig loadRecordToRecordTravel(Path file) {
        return recordToRecordTravelFrom(readDocument(file));
    }

    /**
     * Parses record-to-record travel settings from JSON text.
     */
    public static RecordToRecordTravelConfig parseRecordToRecordTravel(String json) {
        return recordToRecordTravelFrom(parseDocument(json));
    }

    private static AlgorithmParams paramsFrom(JSONObject root) {
        JSONObject scores = section(root, SECTION_SCORES);
        return AlgorithmParams.builder()
                .scoreDecay(readDouble(scores, SECTION_SCORES, KEY_SCORE_DECAY,
                        AlgorithmParams.DEFAULT_SCORE_DECAY, OPEN_UNIT_INTERVAL))
                .newBestMultiplier(readDouble(scores, SECTION_SCORES, KEY_NEW_BEST_MULTIPLIER,
                        AlgorithmParams.DEFAULT_NEW_BEST_MULTIPLIER, FINITE_POSITIVE))
                .newImprovingMultiplier(readDouble(scores, SECTION_SCORES, KEY_NEW_IMPROVING_MULTIPLIER,
                        AlgorithmParams.DEFAULT_NEW_IMPROVING_MULTIPLIER, FINITE_POSITIVE))
                .newAcceptedMultiplier(readDouble(scores, SECTION_SCORES, KEY_NEW_ACCEPTED_MULTIPLIER,
                        AlgorithmParams.DEFAULT_NEW_ACCEPTED_MULTIPLIER, FINITE_POSITIVE))
                .build();
    }

    private static RecordToRecordTravelConfig recordToRecordTravelFrom(JSONObject root) {
        JSONObject acceptance = section(root, SECTION_ACCEPTANCE);
        return RecordToRecordTravelConfig.builder()
                .mainTerminationCriterion(readCriterion(acceptance))
                .iterationsLimit(readLong(root, KEY_ITERATIONS_LIMIT,
                        RecordToRecordTravelConfig.DEFAULT_ITERATIONS_LIMIT))
                .timeLimitSec(readDouble(root, null, KEY_TIME_LIMIT,
                        RecordToRecordTravelConfig.DEFAULT_TIME_LIMIT_SEC, FINITE_POSITIVE))
                .startThreshold(readDouble(acceptance, SECTION_ACCEPTANCE, KEY_START_THRESHOLD,
                        RecordToRecordTravelConfig.DEFAULT_START_THRESHOLD, FINITE_NON_NEGATIVE))
                .endThreshold(readDouble(acceptance, SECTION_ACCEPTANCE, KEY_END_THRESHOLD,
                        RecordToRecordTravelConfig.DEFAULT_END_THRESHOLD, FINITE_NON_NEGATIVE))
                .build();
    }

    private static JSONObject readDocument(Path file) {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return new JSONObject(new JSONTokener(reader));
        } catch (IOException ex) {
            throw new AlnsException(
                    AlnsException.REASON_CONFIG_UNREADABLE,
                    "cannot read ALNS configuration " + file,
                    ex
            );
        } catch (JSONException ex) {
            throw new AlnsException(
                    AlnsException.REASON_CONFIG_UNREADABLE,
                    "ALNS configuration " + file + " is not a JSON object",
                    ex
            );
        }
    }

    private static JSONObject parseDocument(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return new JSONObject(json);
        } catch (JSONException ex) {
            throw new AlnsException(
                    AlnsException.REASON_CONFIG_UNREADABLE,
                    "ALNS configuration is not a JSON object",
                    ex
            );
        }
    }

    /**
     * Returns a nested section, or an empty object when absent or not an object.
     */
    private static JSONObject section(JSONObject root, String name) {
        JSONObject section = root.optJSONObject(name);
        if (section == null) {
            if (root.has(name)) {
                LOG.warn("ALNS configuration section '" + name + "' is not an object; using defaults");
            }
            return new JSONObject();
        }
        return section;
    }

    private static double readDouble(
            JSONObject section,
            String sectionName,
            String key,
            double fallback,
            DoublePredicate valid
    ) {
        Object raw = section.opt(key);
        if (raw == null) {
            return fallback;
        }
        double value = toDouble(raw);
        if (Double.isNaN(value) || !valid.test(value)) {
            warnFallback(sectionName, key, raw, fallback);
            return fallback;
        }
        return value;
    }

    private static long readLong(JSONObject section, String key, long fallback) {
        Object raw = section.opt(key);
        if (raw == null) {
            return fallback;
        }
        double value = toDouble(raw);
        if (!Double.isFinite(value) || value < 1.0d || value != Math.rint(value) || value > Long.MAX_VALUE) {
            warnFallback(null, key, raw, fallback);
            return fallback;
        }
        return (long) value;
    }

    private static MainTerminationCriterion readCriterion(JSONObject acceptance) {
        Object raw = acceptance.opt(KEY_MAIN_TERMINATION_CRITERION);
        if (raw == null) {
            return MainTerminationCriterion.ITERATIONS;
        }
        MainTerminationCriterion criterion = raw instanceof String
                ? MainTerminationCriterion.fromConfigName((String) raw)
                : null;
        if (criterion == null) {
            warnFallback(SECTION_ACCEPTANCE, KEY_MAIN_TERMINATION_CRITERION, raw,
                    MainTerminationCriterion.ITERATIONS.configName());
            return MainTerminationCriterion.ITERATIONS;
        }
        return criterion;
    }

    /**
     * Converts JSON numbers and numeric strings; anything else maps to NaN.
     */
    private static double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException ex) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static void warnFallback(String sectionName, String key, Object raw, Object fallback) {
        String path = sectionName == null ? key : sectionName + "." + key;
        LOG.warn("invalid ALNS configuration value " + path + "=" + raw + "; using default " + fallback);
    }
}
