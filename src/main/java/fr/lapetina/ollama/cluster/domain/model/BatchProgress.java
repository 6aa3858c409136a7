package fr.lapetina.ollama.cluster.domain.model;

/**
 * Progress of a running batch, emitted once per completed chunk.
 *
 * @param completed  number of chunks completed so far, 1..total
 * @param total      number of chunks in the batch
 * @param chunkIndex index of the chunk whose completion triggered this event
 */
public record BatchProgress(int completed, int total, int chunkIndex) {

    public double percent() {
        return total == 0 ? 100.0 : (completed * 100.0) / total;
    }

    public String message() {
        return "Processed " + completed + "/" + total + " chunks";
    }

    public boolean isDone() {
        return completed == total;
    }
}
