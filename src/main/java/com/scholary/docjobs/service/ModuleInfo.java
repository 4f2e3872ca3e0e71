package com.scholary.docjobs.service;

/** A module as listed to clients. */
public record ModuleInfo(
    String key,
    String displayName,
    String description,
    int attemptCap,
    int concurrencyCap,
    String successThreshold) {}
