package com.shop.graphrecs.graph;

@FunctionalInterface
public interface GraphWriterFactory {

    GraphWriter open();
}
