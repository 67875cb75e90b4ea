package com.backupserver.range;

// null bound = not given
public record ByteRange(Long start, Long end) {}
