package io.jsonkv.storage.backend;

class ConcurrentMapBackendTest extends MapBackendContract {

    @Override
    protected MapBackend<String, Integer> newBackend() {
        return new ConcurrentMapBackend<>();
    }
}
