package com.zatca.fatoora.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.zatca.fatoora.exception.FatooraException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Builds a {@link FatooraConfig} from a JSON file, {@code FATOORA_*}
 * environment variables and programmatic values, in increasing priority.
 *
 * <p>Every source is a flat map keyed by the config field name. Values may
 * arrive typed (from JSON or code) or as strings (from the environment);
 * each key knows how to convert its own value.
 */
public class ConfigLoader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Map<String, Setting<?>> SETTINGS;

    static {
        Map<String, Setting<?>> settings = new LinkedHashMap<>();
        settings.put("environment", new Setting<FatooraEnvironment>(ConfigLoader::toEnvironment,
            FatooraConfig.Builder::environment, config -> config.getEnvironment().getValue()));
        settings.put("baseUrl", text(FatooraConfig.Builder::baseUrl, FatooraConfig::getBaseUrl));
        settings.put("complianceApiUrl", text(FatooraConfig.Builder::complianceApiUrl, null));
        settings.put("complianceInvoicesApiUrl", text(FatooraConfig.Builder::complianceInvoicesApiUrl, null));
        settings.put("clearanceApiUrl", text(FatooraConfig.Builder::clearanceApiUrl, null));
        settings.put("reportingApiUrl", text(FatooraConfig.Builder::reportingApiUrl, null));
        settings.put("productionCsidApiUrl", text(FatooraConfig.Builder::productionCsidApiUrl, null));
        settings.put("timeout", number("timeout", FatooraConfig.Builder::timeout, FatooraConfig::getTimeout));
        settings.put("retryAttempts",
            number("retryAttempts", FatooraConfig.Builder::retryAttempts, FatooraConfig::getRetryAttempts));
        settings.put("retryDelay", number("retryDelay", FatooraConfig.Builder::retryDelay, FatooraConfig::getRetryDelay));
        settings.put("enableAuditLog", new Setting<Boolean>(ConfigLoader::toFlag,
            FatooraConfig.Builder::enableAuditLog, FatooraConfig::isEnableAuditLog));
        settings.put("signingCurve", text(FatooraConfig.Builder::signingCurve, FatooraConfig::getSigningCurve));
        settings.put("csidRenewalWindowDays", number("csidRenewalWindowDays",
            FatooraConfig.Builder::csidRenewalWindowDays, FatooraConfig::getCsidRenewalWindowDays));
        SETTINGS = Collections.unmodifiableMap(settings);
    }

    private final ObjectMapper objectMapper;
    private final Function<String, String> environmentReader;

    public ConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param environmentReader source of environment variables, e.g. {@code System::getenv}
     */
    public ConfigLoader(Function<String, String> environmentReader) {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.environmentReader = environmentReader;
    }

    /**
     * Read a flat JSON object.
     *
     * @throws FatooraException {@code CONFIG_FILE_NOT_FOUND} or {@code CONFIG_PARSE_ERROR}
     */
    public Map<String, Object> fromFile(String path) {
        Path file = Paths.get(path).toAbsolutePath();
        if (!Files.exists(file)) {
            throw new FatooraException("Configuration file not found: " + file, "CONFIG_FILE_NOT_FOUND");
        }
        try {
            return objectMapper.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException e) {
            throw new FatooraException("Invalid JSON in configuration file: " + file, "CONFIG_PARSE_ERROR", e);
        }
    }

    /**
     * Collect the set {@code FATOORA_*} variables, already converted to
     * their field types.
     *
     * @throws FatooraException {@code CONFIG_INVALID_VALUE} if a variable cannot be converted
     */
    public Map<String, Object> fromEnvironment() {
        Map<String, Object> values = new HashMap<>();
        FatooraConfigConstants.ENV_VAR_MAPPING.forEach((variable, key) -> {
            String raw = environmentReader.apply(variable);
            if (raw != null && !raw.isEmpty()) {
                values.put(key, SETTINGS.get(key).convert.apply(raw));
            }
        });
        return values;
    }

    /**
     * Overlay the sources left to right. Null values never override.
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();
        for (Map<String, Object> source : sources) {
            source.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        return merged;
    }

    /**
     * Apply known keys to a fresh builder; unknown keys are ignored and
     * absent keys keep their defaults.
     *
     * @throws FatooraException {@code CONFIG_INVALID_VALUE} if a value cannot be converted
     */
    public FatooraConfig resolve(Map<String, Object> values) {
        FatooraConfig.Builder builder = FatooraConfig.builder();
        SETTINGS.forEach((key, setting) -> {
            Object value = values.get(key);
            if (value != null) {
                setting.applyTo(builder, value);
            }
        });
        return builder.build();
    }

    /**
     * File, then environment (if {@code loadEnv}), then programmatic values.
     * Either map source may be null.
     */
    public FatooraConfig load(String filePath, boolean loadEnv, Map<String, Object> programmaticConfig) {
        return resolve(merge(
            filePath != null ? fromFile(filePath) : Map.<String, Object>of(),
            loadEnv ? fromEnvironment() : Map.<String, Object>of(),
            programmaticConfig != null ? programmaticConfig : Map.<String, Object>of()));
    }

    public FatooraConfig loadFromFile(String filePath) {
        return load(filePath, true, null);
    }

    /**
     * Write the default configuration as JSON. Per-endpoint URLs are left
     * out; they follow {@code baseUrl}.
     *
     * @throws FatooraException {@code CONFIG_WRITE_ERROR} if the file cannot be written
     */
    public void createTemplate(String path) {
        FatooraConfig defaults = FatooraConfig.builder().build();
        Map<String, Object> template = new LinkedHashMap<>();
        SETTINGS.forEach((key, setting) -> {
            if (setting.template != null) {
                template.put(key, setting.template.apply(defaults));
            }
        });

        Path file = Paths.get(path).toAbsolutePath();
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), template);
        } catch (IOException e) {
            throw new FatooraException("Failed to create configuration template: " + e.getMessage(),
                "CONFIG_WRITE_ERROR", e);
        }
    }

    private static final class Setting<T> {
        private final Function<Object, T> convert;
        private final BiConsumer<FatooraConfig.Builder, T> apply;
        private final Function<FatooraConfig, Object> template;

        Setting(Function<Object, T> convert, BiConsumer<FatooraConfig.Builder, T> apply,
                Function<FatooraConfig, Object> template) {
            this.convert = convert;
            this.apply = apply;
            this.template = template;
        }

        void applyTo(FatooraConfig.Builder builder, Object value) {
            apply.accept(builder, convert.apply(value));
        }
    }

    private static Setting<String> text(BiConsumer<FatooraConfig.Builder, String> apply,
                                        Function<FatooraConfig, Object> template) {
        return new Setting<>(String::valueOf, apply, template);
    }

    private static Setting<Integer> number(String key, BiConsumer<FatooraConfig.Builder, Integer> apply,
                                           Function<FatooraConfig, Object> template) {
        return new Setting<>(value -> toInt(key, value), apply, template);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new FatooraException("Configuration value " + key + " must be an integer, got: " + value,
                "CONFIG_INVALID_VALUE", e);
        }
    }

    private static boolean toFlag(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        return "true".equalsIgnoreCase(text) || "1".equals(text) || "yes".equalsIgnoreCase(text);
    }

    private static FatooraEnvironment toEnvironment(Object value) {
        if (value instanceof FatooraEnvironment) {
            return (FatooraEnvironment) value;
        }
        try {
            return FatooraEnvironment.fromString(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new FatooraException(e.getMessage(), "CONFIG_INVALID_VALUE", e);
        }
    }
}
