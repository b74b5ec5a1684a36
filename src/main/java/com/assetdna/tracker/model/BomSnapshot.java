package com.assetdna.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable full BOM of one asset as of {@code timestamp}.
 *
 * Never updated after insert. {@code sequence} is the per-asset insertion counter; it orders
 * snapshots sharing a timestamp and its unique index serializes concurrent appends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "bom_snapshots")
@CompoundIndexes({
        @CompoundIndex(name = "snapshot_asset_sequence_idx", def = "{'assetId': 1, 'sequence': 1}", unique = true),
        @CompoundIndex(name = "snapshot_asset_timestamp_idx", def = "{'assetId': 1, 'timestamp': 1, 'sequence': 1}")
})
public class BomSnapshot {

    @Id
    private String id;

    private String assetId;

    private Instant timestamp;

    private long sequence;

    private boolean backfill;

    private String source;

    @Builder.Default
    private List<BomItem> items = new ArrayList<>();

    private Instant createdAt;
}
