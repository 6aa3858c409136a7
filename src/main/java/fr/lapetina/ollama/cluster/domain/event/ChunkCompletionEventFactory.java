package fr.lapetina.ollama.cluster.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating ChunkCompletionEvent instances in the ring buffer.
 */
public final class ChunkCompletionEventFactory implements EventFactory<ChunkCompletionEvent> {

    @Override
    public ChunkCompletionEvent newInstance() {
        return new ChunkCompletionEvent();
    }
}
