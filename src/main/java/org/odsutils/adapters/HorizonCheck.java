package org.odsutils.adapters;

import org.odsutils.models.OdsRecord;
import org.odsutils.models.TimeWindow;
import org.odsutils.models.standard.Standard;

import java.time.Duration;
import java.util.Optional;

public interface HorizonCheck {

    /**
     * Finds when, within the record's own start/stop span, its source is above the elevation limit
     * as seen from the record's site.
     *
     * @return first and last sampled times above the limit, or empty if the source never rises
     *         above it (or the record lacks usable position or time fields)
     */
    Optional<TimeWindow> aboveHorizon(OdsRecord record, Standard standard, double elevationLimitDeg, Duration timeStep);
}
