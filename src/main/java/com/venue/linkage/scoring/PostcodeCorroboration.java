package com.venue.linkage.scoring;

import com.venue.linkage.core.model.LocatorKind;
import com.venue.linkage.core.model.NormalizedVenue;

/**
 * Binary postcode signal: 1.0 when the postcode on one side appears literally in the
 * normalized address on the other side.
 *
 * <p>When both sides carry the same kind of locator, either key containing the other counts.
 * An empty key on either side scores 0.0.</p>
 */
public final class PostcodeCorroboration {

    private PostcodeCorroboration() {
        // Utility class
    }

    public static double score(NormalizedVenue<?> probe, NormalizedVenue<?> candidate) {
        String probeKey = probe.locatorKey();
        String candidateKey = candidate.locatorKey();
        if (probeKey.isEmpty() || candidateKey.isEmpty()) {
            return 0.0;
        }

        LocatorKind probeKind = probe.locatorKind();
        LocatorKind candidateKind = candidate.locatorKind();

        boolean corroborated;
        if (probeKind == LocatorKind.POSTCODE && candidateKind == LocatorKind.ADDRESS) {
            corroborated = candidateKey.contains(probeKey);
        } else if (probeKind == LocatorKind.ADDRESS && candidateKind == LocatorKind.POSTCODE) {
            corroborated = probeKey.contains(candidateKey);
        } else {
            corroborated = probeKey.contains(candidateKey) || candidateKey.contains(probeKey);
        }
        return corroborated ? 1.0 : 0.0;
    }
}
