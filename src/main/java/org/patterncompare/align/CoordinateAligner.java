package org.patterncompare.align;

import org.patterncompare.exceptions.EmptyAlignmentException;
import org.patterncompare.io.TableRole;
import org.patterncompare.model.AlignedRow;
import org.patterncompare.model.AlignedTable;
import org.patterncompare.model.Sample;
import org.patterncompare.model.SampleSchema;
import org.patterncompare.model.SampleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact-key inner join of a reference and a reconstruction table.
 *
 * Both coordinates must be equal at the same time; there is no tolerance and no range
 * normalization, so 180 and -180 are different keys. Keys present in only one table are dropped.
 */
public final class CoordinateAligner {

    private static final Logger log = LoggerFactory.getLogger(CoordinateAligner.class);

    /**
     * @param reference      table holding the actual pattern
     * @param reconstruction table holding the reconstructed pattern
     * @param schema         field names, kept on the result for labelling
     * @return aligned rows in reference order
     * @throws EmptyAlignmentException if no key is shared
     */
    public AlignedTable align(SampleTable reference, SampleTable reconstruction, SampleSchema schema) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(reconstruction, "reconstruction must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        requireRole(reference, TableRole.REFERENCE);
        requireRole(reconstruction, TableRole.RECONSTRUCTION);

        List<AlignedRow> rows = new ArrayList<>(Math.min(reference.size(), reconstruction.size()));
        for (Sample ref : reference.samples()) {
            Optional<Sample> recon = reconstruction.find(ref.key());
            recon.ifPresent(r -> rows.add(new AlignedRow(ref.key(), ref.value(), r.value())));
        }

        if (rows.isEmpty()) {
            throw new EmptyAlignmentException(reference.size(), reconstruction.size());
        }

        AlignedTable aligned = new AlignedTable(schema, rows, reference.size(), reconstruction.size());
        log.info("Aligned {} data points for comparison.", aligned.size());
        if (aligned.unmatchedReferenceRows() > 0 || aligned.unmatchedReconstructionRows() > 0) {
            log.debug("Dropped {} reference and {} reconstruction rows without a matching coordinate",
                    aligned.unmatchedReferenceRows(), aligned.unmatchedReconstructionRows());
        }
        return aligned;
    }

    private static void requireRole(SampleTable table, TableRole expected) {
        if (!table.role().equals(expected)) {
            throw new IllegalArgumentException("Expected a " + expected + " table but got " + table.role());
        }
    }
}
