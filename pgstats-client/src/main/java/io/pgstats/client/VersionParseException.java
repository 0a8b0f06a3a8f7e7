package io.pgstats.client;

public class VersionParseException extends PgStatsException {

    private final String versionText;

    public VersionParseException(String versionText) {
        super("Unrecognized server version: '" + versionText + "'");
        this.versionText = versionText;
    }

    public String getVersionText() {
        return versionText;
    }
}
