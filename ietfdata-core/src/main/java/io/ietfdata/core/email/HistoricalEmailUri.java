package io.ietfdata.core.email;

import io.ietfdata.core.Protocol;
import io.ietfdata.core.ResourceUri;

/**
 * Reference to one historical revision of an email address record, e.g. {@code /api/v1/person/historicalemail/71987/}.
 */
public final class HistoricalEmailUri extends ResourceUri {

    public HistoricalEmailUri(String path) {
        super(path, Protocol.PATH_HISTORICAL_EMAIL);
    }

    public static HistoricalEmailUri of(long historyId) {
        return new HistoricalEmailUri(Protocol.PATH_HISTORICAL_EMAIL + historyId + "/");
    }

    public long historyId() {
        return numericId();
    }

    @Override
    public String kind() {
        return "historical-email";
    }
}
