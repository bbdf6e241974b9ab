package pl.marcinmilkowski.drama_network.model;

/**
 * Bibliographic data of a play as found in its header.
 *
 * Dates are years; any of them may be missing (null).
 */
public record PlayMetadata(
    String title,
    String subtitle,
    String genretitle,
    String author,
    String source,
    Integer datePrint,
    Integer dateWritten,
    Integer datePremiere,
    String filename,
    int segmentCount,
    String countType           // "scenes" or "acts"
) {

    /**
     * Metadata for plays that come without a header.
     */
    public static PlayMetadata untitled(String title, int segmentCount) {
        return new PlayMetadata(title, "", "", "", "", null, null, null, title, segmentCount, "acts");
    }

    /**
     * The single year used to place the play in time.
     *
     * The earlier of print and premiere wins; the writing date replaces it when the
     * play was written more than ten years before, or when it is the only date known.
     */
    public Integer dateDefinite() {
        return resolveDefiniteDate(datePrint, dateWritten, datePremiere);
    }

    public static Integer resolveDefiniteDate(Integer print, Integer written, Integer premiere) {
        Integer definite;
        if (print != null && premiere != null) {
            definite = Math.min(print, premiere);
        } else if (premiere != null) {
            definite = premiere;
        } else {
            definite = print;
        }

        if (written != null && definite != null) {
            if (definite - written > 10) {
                definite = written;
            }
        } else if (written != null) {
            definite = written;
        }
        return definite;
    }
}
