package io.jsonkv.storage.dto;

/** On-disk shape of a store config file. Missing fields stay null. */
public class JsonStoreConfig {
    public String path;
    public String policy;
    public Long flushIntervalMillis;
    public Boolean pretty;
}
