package com.credo.cache.application.port.out;

@FunctionalInterface
public interface StoreErrorListener {

    void onError(StoreError error);
}
