package com.dburyak.jsonrpc2;

import io.reactivex.rxjava3.core.Single;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.rxjava3.config.ConfigRetriever;
import io.vertx.rxjava3.core.Vertx;
import lombok.Value;

import java.util.List;
import java.util.function.Supplier;

@Value
public class Config {
    public static final String CFG_PREFIX_ENV = "JSONRPC2_";
    public static final String NOTIFICATION_POLICY_ENV = CFG_PREFIX_ENV + "NOTIFICATION_POLICY";
    public static final List<String> ALL_ENV_VARS = List.of(
            NOTIFICATION_POLICY_ENV
    );
    public static final String CFG_FILE = "jsonrpc2.yaml";

    private static final String CFG_PREFIX = "jsonrpc2";
    private static final String NOTIFICATION_POLICY = "notificationPolicy";
    private static final NotificationPolicy NOTIFICATION_POLICY_DEFAULT = NotificationPolicy.SURFACE_ERRORS;

    NotificationPolicy notificationPolicy;

    public Config(JsonObject cfgRootJson) {
        var cfgJson = cfgRootJson.getJsonObject(CFG_PREFIX);
        this.notificationPolicy = NotificationPolicy.parse(getString(NOTIFICATION_POLICY_ENV, cfgRootJson,
                NOTIFICATION_POLICY, cfgJson, NOTIFICATION_POLICY_DEFAULT::name));
    }

    public static Config defaults() {
        return new Config(new JsonObject());
    }

    /**
     * Loads config from the optional {@value #CFG_FILE} file (working dir or classpath), env vars take precedence.
     */
    public static Single<Config> retrieve(Vertx vertx) {
        var cfgRetriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .setIncludeDefaultStores(false)
                .addStore(new ConfigStoreOptions()
                        .setType("file")
                        .setFormat("yaml")
                        .setOptional(true)
                        .setConfig(new JsonObject()
                                .put("path", CFG_FILE)))
                .addStore(new ConfigStoreOptions()
                        .setType("env")
                        .setConfig(new JsonObject()
                                .put("keys", new JsonArray(ALL_ENV_VARS)))));
        return cfgRetriever.rxGetConfig()
                .map(Config::new)
                .doFinally(cfgRetriever::close);
    }

    private static String getString(String envVarName, JsonObject cfgJson, String cfgName, JsonObject subCfgJson,
            Supplier<String> defaultValue) {
        if (envVarName != null) {
            var envValue = cfgJson.getValue(envVarName);
            if (envValue != null) {
                return envValue.toString();
            }
        }
        if (subCfgJson != null && cfgName != null) {
            var cfgValue = subCfgJson.getValue(cfgName);
            if (cfgValue != null) {
                return cfgValue.toString();
            }
        }
        return defaultValue.get();
    }
}
