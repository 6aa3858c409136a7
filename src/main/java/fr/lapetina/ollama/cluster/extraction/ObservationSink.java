package fr.lapetina.ollama.cluster.extraction;

import fr.lapetina.ollama.cluster.domain.model.Observation;

import java.util.List;

/**
 * Consumer of the observations of a completed batch, in chunk order.
 */
@FunctionalInterface
public interface ObservationSink {

    ObservationSink NONE = observations -> { };

    void accept(List<Observation> observations);
}
