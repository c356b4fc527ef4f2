package io.ietfdata.core.person;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to one historical revision of a person record, e.g. {@code /api/v1/person/historicalperson/11731/}.
 */
public final class HistoricalPersonUri extends ResourceUri {

    public HistoricalPersonUri(String path) {
        super(path, Protocol.PATH_HISTORICAL_PERSON);
    }

    public static HistoricalPersonUri of(long historyId) {
        return new HistoricalPersonUri(Protocol.PATH_HISTORICAL_PERSON + historyId + "/");
    }

    public long historyId() {
        return numericId();
    }

    @Override
    public String kind() {
        return "historical-person";
    }
}
