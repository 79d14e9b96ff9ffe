package com.hcltech.rebac.service;

import com.hcltech.rebac.common.IEnvGetter;

/**
 * @param workerThreads           size of the request pool
 * @param maxDepth                depth limit for permission checks, 0 for unlimited
 * @param defaultSubjectNamespace namespace of the caller entity used when a request has no src
 */
public record RebacConfig(int workerThreads, int maxDepth, String defaultSubjectNamespace) {

    public static final String WORKER_THREADS = "REBAC_WORKER_THREADS";
    public static final String MAX_DEPTH = "REBAC_MAX_DEPTH";
    public static final String DEFAULT_SUBJECT_NAMESPACE = "REBAC_DEFAULT_SUBJECT_NAMESPACE";

    public RebacConfig {
        if (workerThreads < 1)
            throw new IllegalStateException(WORKER_THREADS + " must be at least 1, was " + workerThreads);
        if (maxDepth < 0)
            throw new IllegalStateException(MAX_DEPTH + " must not be negative, was " + maxDepth);
        if (defaultSubjectNamespace == null || defaultSubjectNamespace.isBlank())
            throw new IllegalStateException(DEFAULT_SUBJECT_NAMESPACE + " must not be blank");
    }

    public static RebacConfig fromEnv(IEnvGetter env) {
        return new RebacConfig(
                IEnvGetter.getIntOr(env, WORKER_THREADS, Runtime.getRuntime().availableProcessors()),
                IEnvGetter.getIntOr(env, MAX_DEPTH, 0),
                IEnvGetter.getStringOr(env, DEFAULT_SUBJECT_NAMESPACE, "user"));
    }
}
