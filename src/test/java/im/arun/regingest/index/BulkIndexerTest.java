package im.arun.regingest.index;

import im.arun.regingest.exception.PartialBulkFailureException;
import im.arun.regingest.exception.PermanentHttpException;
import im.arun.regingest.exception.TransientNetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class BulkIndexerTest {

    public static class Note implements IndexableRecord {
        private final String id;
        private final String text;

        public Note(String id, String text) {
            this.id = id;
            this.text = text;
        }

        public String getId() {
            return id;
        }

        public String getText() {
            return text;
        }

        @Override
        public String documentKey() {
            return "note_" + id;
        }
    }

    private SearchStore store;
    private BulkIndexer indexer;

    @BeforeEach
    void setUp() {
        store = mock(SearchStore.class);
        indexer = new BulkIndexer(store, 2, 0);
    }

    @SuppressWarnings("unchecked")
    private List<IndexAction> firstBatch() {
        ArgumentCaptor<List<IndexAction>> captor = ArgumentCaptor.forClass(List.class);
        verify(store, atLeastOnce()).bulkUpsert(eq("notes"), captor.capture());
        return captor.getAllValues().get(0);
    }

    @Test
    void duplicateKeysCollapseToTheLastRecord() {
        when(store.bulkUpsert(eq("notes"), anyList())).thenAnswer(inv ->
                BulkResult.allAccepted(((List<?>) inv.getArgument(1)).size()));

        int accepted = indexer.store("notes", List.of(
                new Note("1", "first"), new Note("2", "other"), new Note("1", "second")));

        assertThat(accepted).isEqualTo(2);
        List<IndexAction> batch = firstBatch();
        assertThat(batch).extracting(IndexAction::getDocumentKey).containsExactly("note_1", "note_2");
        assertThat(batch.get(0).getDocument().path("text").asText()).isEqualTo("second");
        assertThat(batch.get(0).getDocument().path("document_uri").asText()).isEqualTo("note_1");
        assertThat(batch.get(0).getCollection()).isEqualTo("notes");
    }

    @Test
    void transientItemFailuresAreResubmitted() {
        when(store.bulkUpsert(eq("notes"), anyList()))
                .thenReturn(new BulkResult(1, Map.of("note_2", new BulkItemError(429, "too many requests"))))
                .thenReturn(BulkResult.allAccepted(1));

        int accepted = indexer.store("notes", List.of(new Note("1", "a"), new Note("2", "b")));

        assertThat(accepted).isEqualTo(2);
        verify(store, times(2)).bulkUpsert(eq("notes"), anyList());
    }

    @Test
    void permanentItemFailuresAreReportedAfterTheRestIsAccepted() {
        when(store.bulkUpsert(eq("notes"), anyList()))
                .thenReturn(new BulkResult(1, Map.of("note_2", new BulkItemError(400, "mapper_parsing_exception"))));

        assertThatThrownBy(() -> indexer.store("notes", List.of(new Note("1", "a"), new Note("2", "b"))))
                .isInstanceOf(PartialBulkFailureException.class)
                .satisfies(e -> {
                    PartialBulkFailureException failure = (PartialBulkFailureException) e;
                    assertThat(failure.getFailedKeys()).containsExactly("note_2");
                    assertThat(failure.getAcceptedCount()).isEqualTo(1);
                    assertThat(failure.getCauses().get("note_2")).contains("mapper_parsing_exception");
                });
        verify(store, times(1)).bulkUpsert(eq("notes"), anyList());
    }

    @Test
    void wholeCallTransientFailureIsRetriedThenReported() {
        when(store.bulkUpsert(eq("notes"), anyList())).thenThrow(new TransientNetworkException("503"));

        assertThatThrownBy(() -> indexer.store("notes", List.of(new Note("1", "a"))))
                .isInstanceOf(PartialBulkFailureException.class)
                .satisfies(e -> assertThat(((PartialBulkFailureException) e).getFailedKeys())
                        .containsExactly("note_1"));
        verify(store, times(3)).bulkUpsert(eq("notes"), anyList());
    }

    @Test
    void wholeCallPermanentFailureIsNotRetried() {
        when(store.bulkUpsert(eq("notes"), anyList())).thenThrow(new PermanentHttpException(403, "http://es/_bulk"));

        assertThatThrownBy(() -> indexer.store("notes", List.of(new Note("1", "a"), new Note("2", "b"))))
                .isInstanceOf(PartialBulkFailureException.class)
                .satisfies(e -> assertThat(((PartialBulkFailureException) e).getAcceptedCount()).isZero());
        verify(store, times(1)).bulkUpsert(eq("notes"), anyList());
    }

    @Test
    void emptyBatchMakesNoStoreCall() {
        assertThat(indexer.store("notes", List.of())).isZero();
        verify(store, never()).bulkUpsert(eq("notes"), anyList());
    }

    @Test
    void rerunningTheSameBatchKeepsOneDocumentPerKey() {
        InMemorySearchStore memory = new InMemorySearchStore();
        BulkIndexer real = new BulkIndexer(memory, 0, 0);
        List<Note> notes = List.of(new Note("1", "a"), new Note("2", "b"));

        real.store("notes", notes);
        real.store("notes", notes);

        assertThat(memory.count("notes")).isEqualTo(2);
    }
}
