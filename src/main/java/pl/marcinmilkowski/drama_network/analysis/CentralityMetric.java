package pl.marcinmilkowski.drama_network.analysis;

/**
 * The four per-character measures that get ranked, in reporting order.
 */
public enum CentralityMetric {
    DEGREE("degree"),
    CLOSENESS("closeness"),
    BETWEENNESS("betweenness"),
    FREQUENCY("frequency");

    private final String columnName;

    CentralityMetric(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    public String rankColumnName() {
        return columnName + "_rank";
    }

    public double valueOf(CharacterMetrics row) {
        switch (this) {
            case DEGREE:
                return row.degree();
            case CLOSENESS:
                return row.closeness();
            case BETWEENNESS:
                return row.betweenness();
            default:
                return row.frequency();
        }
    }

    public int rankOf(CharacterMetrics.Ranks ranks) {
        switch (this) {
            case DEGREE:
                return ranks.degree();
            case CLOSENESS:
                return ranks.closeness();
            case BETWEENNESS:
                return ranks.betweenness();
            default:
                return ranks.frequency();
        }
    }
}
