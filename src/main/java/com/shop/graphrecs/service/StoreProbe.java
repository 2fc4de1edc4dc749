package com.shop.graphrecs.service;

/**
 * One minimal round trip against a store; returns normally when the store answered.
 */
@FunctionalInterface
public interface StoreProbe {

    void check() throws Exception;
}
