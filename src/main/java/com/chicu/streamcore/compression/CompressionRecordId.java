package com.chicu.streamcore.compression;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

/**
 * Ключ сжатой копии: id исходной записи уникален только внутри своего типа.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class CompressionRecordId implements Serializable {

    private CompressedRecordType recordType;
    private String recordId;

    @Override
    public String toString() {
        return recordType + ":" + recordId;
    }
}
