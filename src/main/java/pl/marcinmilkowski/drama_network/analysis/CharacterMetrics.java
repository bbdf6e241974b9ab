package pl.marcinmilkowski.drama_network.analysis;

/**
 * One row of the character metrics table.
 *
 * {@code ranks} is null until the table has gone through the {@link RankAggregator}.
 */
public record CharacterMetrics(
    String character,
    int frequency,             // Segments the character speaks in
    int degree,                // Distinct co-occurring characters
    double betweenness,
    double closeness,
    Ranks ranks
) {

    /**
     * Dense ranks (1 = highest value) and the averages derived from them.
     */
    public record Ranks(int degree, int closeness, int betweenness, int frequency) {

        /**
         * Mean of the three structural ranks.
         */
        public double avgCentrality() {
            return (degree + closeness + betweenness) / 3.0;
        }

        /**
         * Mean of the frequency rank and the average structural rank.
         */
        public double composite() {
            return (frequency + avgCentrality()) / 2.0;
        }
    }

    public boolean isRanked() {
        return ranks != null;
    }

    public CharacterMetrics withRanks(Ranks newRanks) {
        return new CharacterMetrics(character, frequency, degree, betweenness, closeness, newRanks);
    }
}
