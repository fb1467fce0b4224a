package io.jsonkv.storage;

/** Flush outcome counters of one store, foreground and background together. */
public record FlushStats(long completed, long failed) {
}
