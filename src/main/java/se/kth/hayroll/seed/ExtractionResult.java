package se.kth.hayroll.seed;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.tag.HayrollTag;

/** The seeds found in a workspace, together with the begin tags that found no end tag. */
public class ExtractionResult {
    private final List<HayrollSeed> seeds;
    private final List<HayrollTag> unmatchedBeginTags;

    ExtractionResult(List<HayrollSeed> seeds, List<HayrollTag> unmatchedBeginTags) {
        this.seeds = Collections.unmodifiableList(seeds);
        this.unmatchedBeginTags = Collections.unmodifiableList(unmatchedBeginTags);
    }

    /** @return All seeds in document order, unmatched statement seeds included. */
    public List<HayrollSeed> getSeeds() {
        return seeds;
    }

    public List<HayrollTag> getUnmatchedBeginTags() {
        return unmatchedBeginTags;
    }

    /**
     * @return The seeds, provided that every statement seed is matched.
     * @throws ExtractionException if some begin tag has no end tag.
     */
    public List<HayrollSeed> requireMatched() {
        if (!unmatchedBeginTags.isEmpty()) {
            throw new ExtractionException(
                    "Unmatched begin tags: "
                            + unmatchedBeginTags.stream()
                                    .map(HayrollTag::locBegin)
                                    .collect(Collectors.joining(", ")));
        }
        return seeds;
    }
}
