package com.chicu.streamcore.compression;

public enum CompressedRecordType {
    EVENT,
    TRADE
}
