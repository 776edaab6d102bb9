package com.geico.poc.ttlindex.worker;

/**
 * Source of the worker's reloadable settings. Called once at worker start and
 * again on every reload request.
 */
public interface WorkerSettingsProvider {

    WorkerSettings load();
}
