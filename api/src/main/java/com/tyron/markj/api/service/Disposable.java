package com.tyron.markj.api.service;

/**
 * Something that holds listeners, timers or other resources that must be released explicitly.
 */
public interface Disposable {

    void dispose();
}
