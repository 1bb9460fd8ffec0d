package com.shoptrends.warehouse.transform;

import com.shoptrends.warehouse.source.FlatRecord;
import lombok.Value;

import java.util.List;

/**
 * Output of {@link DimensionExtractor#extract}.
 */
@Value
public class DimensionExtraction {

    DimensionSets dimensions;

    /** Records that passed every field check, in input order. */
    List<FlatRecord> accepted;

    List<RecordRejection> rejections;

    /** Consistency violations resolved by the {@code LATER_WINS} policy. */
    List<RecordRejection> conflicts;
}
