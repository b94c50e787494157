package com.social.tipping.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

// Disabled in tests that supply their own client.
@Configuration
@ConditionalOnProperty(name = "aerospike.enabled", havingValue = "true", matchIfMissing = true)
public class AerospikeConfig {

    public static final String SET_RATE_WINDOWS = "rate_windows";
    public static final String SET_RATE_BLOCKS = "rate_blocks";
    public static final String SET_ABUSE_SIGNALS = "abuse_signals";
    public static final String SET_LEADERBOARDS = "leaderboards";
    public static final String SET_USER_TIP_STATS = "user_tip_stats";
    public static final String SET_USER_WEEKLY_STATS = "user_weekly_stats";
    public static final String SET_CREDITED_TIPS = "credited_tips";
    public static final String SET_TIP_JOBS = "tip_jobs";
    public static final String SET_TIP_JOBS_DLQ = "tip_jobs_dlq";
    public static final String SET_TIP_REVIEWS = "tip_reviews";
    public static final String SET_ACHIEVEMENTS = "achievements";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:tipping}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;

        // Read policy defaults
        clientPolicy.readPolicyDefault.totalTimeout = 1000;
        clientPolicy.readPolicyDefault.socketTimeout = 500;

        // Write policy defaults
        clientPolicy.writePolicyDefault.totalTimeout = 1000;
        clientPolicy.writePolicyDefault.socketTimeout = 500;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 1000;
        policy.socketTimeout = 500;
        return policy;
    }

    @Bean
    public BatchPolicy defaultBatchPolicy() {
        BatchPolicy policy = new BatchPolicy();
        policy.totalTimeout = 2000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
