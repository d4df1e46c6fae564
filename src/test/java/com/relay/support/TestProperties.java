package com.relay.support;

import com.relay.config.RelayProperties;

/**
 * Small property sets for unit tests.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static RelayProperties withPools(RelayProperties.PoolDefinition... pools) {
        RelayProperties properties = new RelayProperties();
        for (RelayProperties.PoolDefinition pool : pools) {
            properties.getPools().add(pool);
        }
        return properties;
    }

    public static RelayProperties.PoolDefinition pool(String id, String provider, long dailyLimit, int priority) {
        RelayProperties.PoolDefinition pool = new RelayProperties.PoolDefinition();
        pool.setPoolId(id);
        pool.setProvider(provider);
        pool.setApiKey("key-" + id);
        pool.setDailyLimit(dailyLimit);
        pool.setPriority(priority);
        return pool;
    }
}
