package com.example.fileparser.service;

import java.util.function.IntConsumer;

@FunctionalInterface
public interface ProgressSimulator {

    void simulate(int totalRecords, IntConsumer progressSink) throws InterruptedException;
}
