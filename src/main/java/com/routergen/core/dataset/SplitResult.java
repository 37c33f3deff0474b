package com.routergen.core.dataset;

import com.routergen.core.example.Example;

import java.util.List;

public final class SplitResult {

    private final List<Example> train;
    private final List<Example> test;

    SplitResult(List<Example> train, List<Example> test) {
        this.train = List.copyOf(train);
        this.test  = List.copyOf(test);
    }

    public List<Example> getTrain() { return train; }
    public List<Example> getTest()  { return test; }
}
