package com.umitunal.stepflow.spi;

public interface ExecutionDetailSink {

    void record(ExecutionDetail detail) throws Exception;
}
