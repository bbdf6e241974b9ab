package pl.marcinmilkowski.drama_network.analysis;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.drama_network.model.CharacterSelection;
import pl.marcinmilkowski.drama_network.model.MetricValue;
import pl.marcinmilkowski.drama_network.model.PlayMetadata;

/**
 * One record of play-level statistics: graph metrics, random baseline and
 * temporal dynamics, together with the play's metadata.
 */
public record GraphMetricsSummary(
    String id,
    PlayMetadata metadata,
    int charcount,
    int edgecount,
    MetricValue maxdegree,
    MetricValue avgdegree,
    MetricValue density,
    MetricValue avgpathlength,
    MetricValue clusteringCoefficient,
    int connectedComponents,
    MetricValue randavgpathl,
    MetricValue randcluster,
    MetricValue allInIndex,
    MetricValue changeRateMean,
    MetricValue changeRateStd,
    MetricValue finalSceneSizeIndex,
    CharacterSelection centralCharacter,
    MetricValue centralCharacterEntryIndex,
    String charactersLastIn
) {

    public static GraphMetricsSummary of(String id, PlayMetadata metadata, GraphMetrics graph,
                                         RandomBaseline baseline, TemporalMetrics temporal,
                                         CharacterSelection centralCharacter) {
        return new GraphMetricsSummary(
            id,
            metadata,
            graph.charcount(),
            graph.edgecount(),
            graph.maxdegree(),
            graph.avgdegree(),
            graph.density(),
            graph.avgpathlength(),
            graph.clusteringCoefficient(),
            graph.connectedComponents(),
            baseline.avgPathLength(),
            baseline.clustering(),
            temporal.allInIndex(),
            temporal.changeRateMean(),
            temporal.changeRateStd(),
            temporal.finalSceneSizeIndex(),
            centralCharacter,
            temporal.centralCharacterEntryIndex(),
            temporal.charactersLastIn()
        );
    }

    /**
     * Export as a JSONObject; undefined numbers become "NaN", ties "SEVERAL".
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("ID", id);
        if (metadata != null) {
            obj.put("author", metadata.author());
            obj.put("title", metadata.title());
            obj.put("subtitle", metadata.subtitle());
            obj.put("genretitle", metadata.genretitle());
            obj.put("year", metadata.dateDefinite());
            obj.put("filename", metadata.filename());
            obj.put("segment_count", metadata.segmentCount());
            obj.put("count_type", metadata.countType());
        }
        obj.put("charcount", charcount);
        obj.put("edgecount", edgecount);
        obj.put("maxdegree", maxdegree.toJsonValue());
        obj.put("avgdegree", avgdegree.toJsonValue());
        obj.put("density", density.toJsonValue());
        obj.put("avgpathlength", avgpathlength.toJsonValue());
        obj.put("clustering_coefficient", clusteringCoefficient.toJsonValue());
        obj.put("connected_components", connectedComponents);
        obj.put("randavgpathl", randavgpathl.toJsonValue());
        obj.put("randcluster", randcluster.toJsonValue());
        obj.put("all_in_index", allInIndex.toJsonValue());
        obj.put("change_rate_mean", changeRateMean.toJsonValue());
        obj.put("change_rate_std", changeRateStd.toJsonValue());
        obj.put("final_scene_size_index", finalSceneSizeIndex.toJsonValue());
        obj.put("central_character", centralCharacter.toString());
        obj.put("central_character_entry_index", centralCharacterEntryIndex.toJsonValue());
        obj.put("characters_last_in", charactersLastIn);
        return obj;
    }
}
