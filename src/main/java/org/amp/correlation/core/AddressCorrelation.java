package org.amp.correlation.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.amp.core.geo.AddressRecord;
import org.amp.correlation.algorithm.ZoneMatch;

import java.util.Optional;

/**
 * One address correlated against both zone datasets: environmental restriction zones and
 * paid parking zones. Zone indices refer to the respective dataset's list.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class AddressCorrelation {
    private final int addressIndex;
    private final AddressRecord address;
    private final Optional<ZoneMatch> environmentalMatch;
    private final Optional<ZoneMatch> parkingMatch;

    public boolean hasAnyMatch() {
        return environmentalMatch.isPresent() || parkingMatch.isPresent();
    }

    public boolean hasBothMatches() {
        return environmentalMatch.isPresent() && parkingMatch.isPresent();
    }

    @Override
    public String toString() {
        return "AddressCorrelation[index=" + addressIndex +
                ", environmental=" + environmentalMatch.map(ZoneMatch::toString).orElse("none") +
                ", parking=" + parkingMatch.map(ZoneMatch::toString).orElse("none") + "]";
    }
}
