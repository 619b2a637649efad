package com.ozmeta.compiler.model.canonical;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A deployment target. The canonical name is derived from the tuple and is
 * never stored.
 */
@Value
@Builder
@Jacksonized
public class TargetDefinition {
    public static final String ALL_DOMAINS = "All";

    UUID id;
    String client;
    String env;
    String platform;
    String domain;
    String region;
    String switchGroup;
    boolean active;

    @JsonIgnore
    public String getCanonicalName() {
        return String.join("-", client, env, platform, domain, region);
    }

    @JsonIgnore
    public boolean isProductionSlot() {
        return "ProdA".equalsIgnoreCase(env) || "ProdB".equalsIgnoreCase(env);
    }

    public boolean coversDomain(String tableDomain) {
        return tableDomain == null || ALL_DOMAINS.equalsIgnoreCase(domain) || domain.equalsIgnoreCase(tableDomain);
    }
}
