package com.configmirror.sdk;

import static com.configmirror.sdk.AssertHelpers.requireNoMoreValues;
import static com.configmirror.sdk.AssertHelpers.requireValue;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.concurrent.TimeUnit;

public class IdListSynchronizerTest {
    private static final String URL_1 = "https://cdn.example.com/list_1";
    private static final String URL_2 = "https://cdn.example.com/list_2";

    private final MockSpecsFetcher fetcher = new MockSpecsFetcher();
    private final IdListRegistry registry = new IdListRegistry();
    private final SimpleTestTaskExecutor taskExecutor = new SimpleTestTaskExecutor();
    private final CapturingErrorReporter errorReporter = new CapturingErrorReporter();

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    private IdListSynchronizer makeSynchronizer() {
        return new IdListSynchronizer(fetcher, registry, taskExecutor, errorReporter, logging.logger);
    }

    @After
    public void tearDown() {
        taskExecutor.close();
    }

    @Test
    public void addsAndRemovesIdsFromNewList() {
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 14, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n+def\n-abc\n", 14);

        makeSynchronizer().reconcileCatalog();

        IdList list = registry.get("list_1");
        assertNotNull(list);
        assertEquals(14, list.getSize());
        assertTrue(list.contains("def"));
        assertFalse(list.contains("abc"));
        assertEquals(1, list.count());
        assertEquals("file_1", list.getFileId());
        assertEquals(URL_1 + "@0", requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS));
        errorReporter.requireNoErrors();
    }

    @Test
    public void laterSyncFetchesOnlyNewBytes() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n+def\n");
        synchronizer.reconcileCatalog();
        IdList list = registry.get("list_1");

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 20, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+ghi\n-abc\n");
        synchronizer.reconcileCatalog();

        assertSame(list, registry.get("list_1"));
        assertEquals(20, list.getSize());
        assertEquals(new HashSet<>(Arrays.asList("def", "ghi")), list.getIds());
        assertEquals(URL_1 + "@0", requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS));
        assertEquals(URL_1 + "@10", requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS));
    }

    @Test
    public void noFetchWhenServerSizeIsNotLarger() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();
        requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS);

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        synchronizer.reconcileCatalog();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 3, 1, URL_1, "file_1").build());
        synchronizer.reconcileCatalog();

        requireNoMoreValues(fetcher.receivedRangeRequests, 50, TimeUnit.MILLISECONDS);
        assertEquals(5, registry.get("list_1").getSize());
        assertTrue(registry.get("list_1").contains("abc"));
    }

    @Test
    public void newFileIdResetsList() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n+def\n");
        synchronizer.reconcileCatalog();
        IdList oldList = registry.get("list_1");

        String newUrl = URL_1 + "?v=2";
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 2, newUrl, "file_2").build());
        fetcher.setupRange(newUrl, "+xyz\n");
        synchronizer.reconcileCatalog();

        IdList newList = registry.get("list_1");
        assertNotSame(oldList, newList);
        assertEquals("file_2", newList.getFileId());
        assertEquals(2, newList.getCreationTime());
        assertEquals(newUrl, newList.getUrl());
        assertEquals(5, newList.getSize());
        assertEquals(new HashSet<>(Arrays.asList("xyz")), newList.getIds());
        requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS);
        assertEquals(newUrl + "@0", requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS));
    }

    @Test
    public void newFileIdWithSameCreationTimeAlsoResets() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_2, "file_2").build());
        fetcher.setupRange(URL_2, "+def\n");
        synchronizer.reconcileCatalog();

        IdList list = registry.get("list_1");
        assertEquals("file_2", list.getFileId());
        assertFalse(list.contains("abc"));
        assertTrue(list.contains("def"));
    }

    @Test
    public void newFileIdAfterExecutorClosedKeepsOldContent() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();
        IdList oldList = registry.get("list_1");
        requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS);

        taskExecutor.close();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 2, URL_2, "file_2").build());
        synchronizer.reconcileCatalog();

        IdList list = registry.get("list_1");
        assertSame(oldList, list);
        assertEquals("file_1", list.getFileId());
        assertEquals(5, list.getSize());
        assertTrue(list.contains("abc"));
        requireNoMoreValues(fetcher.receivedRangeRequests, 50, TimeUnit.MILLISECONDS);
    }

    @Test
    public void olderCatalogEntryIsIgnored() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 10, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();
        requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS);

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 50, 9, URL_2, "file_0").build());
        synchronizer.reconcileCatalog();

        requireNoMoreValues(fetcher.receivedRangeRequests, 50, TimeUnit.MILLISECONDS);
        IdList list = registry.get("list_1");
        assertEquals("file_1", list.getFileId());
        assertEquals(5, list.getSize());
        assertTrue(list.contains("abc"));
        errorReporter.requireNoErrors();
    }

    @Test
    public void entryWithoutUrlOrFileIdLeavesEmptyPlaceholder() {
        fetcher.setupCatalog(SpecsJson.catalog()
                .list("no_url", 5, 1, null, "file_1")
                .list("no_file", 5, 1, URL_2, null)
                .build());

        makeSynchronizer().reconcileCatalog();

        requireNoMoreValues(fetcher.receivedRangeRequests, 50, TimeUnit.MILLISECONDS);
        assertEquals(new HashSet<>(Arrays.asList("no_url", "no_file")), registry.names());
        assertEquals(0, registry.get("no_url").getSize());
        assertEquals(0, registry.get("no_file").count());
        errorReporter.requireNoErrors();
    }

    @Test
    public void contentWithBadFirstCharacterDiscardsList() {
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "<html>oops");

        makeSynchronizer().reconcileCatalog();

        assertNull(registry.get("list_1"));
        SyncFailure failure = errorReporter.requireSyncFailure(SyncFailure.FailureType.CORRUPT_ID_LIST);
        assertThat(failure.getMessage(), containsString("list_1"));
    }

    @Test
    public void contentOfOneCharacterDiscardsList() {
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+");

        makeSynchronizer().reconcileCatalog();

        assertNull(registry.get("list_1"));
        errorReporter.requireSyncFailure(SyncFailure.FailureType.CORRUPT_ID_LIST);
    }

    @Test
    public void emptyContentDiscardsList() {
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "", 10);

        makeSynchronizer().reconcileCatalog();

        assertNull(registry.get("list_1"));
        SyncFailure failure = errorReporter.requireSyncFailure(SyncFailure.FailureType.CORRUPT_ID_LIST);
        assertThat(failure.getMessage(), containsString("does not start with"));
    }

    @Test
    public void missingContentLengthDiscardsList() {
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n", -1);

        makeSynchronizer().reconcileCatalog();

        assertNull(registry.get("list_1"));
        errorReporter.requireSyncFailure(SyncFailure.FailureType.CORRUPT_ID_LIST);
    }

    @Test
    public void corruptListIsFetchedAgainFromStartOnNextSync() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "garbage");
        synchronizer.reconcileCatalog();
        requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS);

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        assertEquals(URL_1 + "@0", requireValue(fetcher.receivedRangeRequests, 1, TimeUnit.SECONDS));
        assertTrue(registry.get("list_1").contains("abc"));
    }

    @Test
    public void transportFailureKeepsList() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 10, 1, URL_1, "file_1").build());
        fetcher.setupRangeError(URL_1, new SyncFailure("boom", SyncFailure.FailureType.NETWORK_FAILURE));
        synchronizer.reconcileCatalog();

        IdList list = registry.get("list_1");
        assertEquals(5, list.getSize());
        assertTrue(list.contains("abc"));
        errorReporter.requireSyncFailure(SyncFailure.FailureType.NETWORK_FAILURE);
    }

    @Test
    public void handlesCarriageReturnsBlankLinesAndUnknownOperations() {
        String content = "+abc\r\n\r\n+def\n  +ghi  \n*zzz\n-\n+\n-def\r\n";
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", content.length(), 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, content);

        makeSynchronizer().reconcileCatalog();

        IdList list = registry.get("list_1");
        assertEquals(new HashSet<>(Arrays.asList("abc", "ghi")), list.getIds());
        assertEquals(content.length(), list.getSize());
    }

    @Test
    public void listsMissingFromCatalogAreRemoved() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog()
                .list("list_1", 5, 1, URL_1, "file_1")
                .list("list_2", 5, 1, URL_2, "file_2")
                .build());
        fetcher.setupRange(URL_1, "+abc\n");
        fetcher.setupRange(URL_2, "+def\n");
        synchronizer.reconcileCatalog();
        assertEquals(new HashSet<>(Arrays.asList("list_1", "list_2")), registry.names());

        fetcher.setupCatalog(SpecsJson.catalog().list("list_2", 5, 1, URL_2, "file_2").build());
        synchronizer.reconcileCatalog();

        assertNull(registry.get("list_1"));
        assertNotNull(registry.get("list_2"));
    }

    @Test
    public void emptyCatalogRemovesAllLists() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        fetcher.setupCatalog("{}");
        synchronizer.reconcileCatalog();

        assertEquals(0, registry.names().size());
        errorReporter.requireNoErrors();
    }

    @Test
    public void malformedCatalogLeavesRegistryUntouched() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        fetcher.setupCatalog("[1, 2]");
        synchronizer.reconcileCatalog();
        errorReporter.requireSyncFailure(SyncFailure.FailureType.INVALID_RESPONSE_BODY);

        fetcher.setupCatalog("null");
        synchronizer.reconcileCatalog();
        errorReporter.requireSyncFailure(SyncFailure.FailureType.INVALID_RESPONSE_BODY);

        assertTrue(registry.get("list_1").contains("abc"));
    }

    @Test
    public void catalogFetchFailureLeavesRegistryUntouched() {
        IdListSynchronizer synchronizer = makeSynchronizer();
        fetcher.setupCatalog(SpecsJson.catalog().list("list_1", 5, 1, URL_1, "file_1").build());
        fetcher.setupRange(URL_1, "+abc\n");
        synchronizer.reconcileCatalog();

        fetcher.setupCatalogError(new InvalidResponseCodeFailure("server error", 503, true));
        synchronizer.reconcileCatalog();

        SyncFailure failure = errorReporter.requireSyncFailure(SyncFailure.FailureType.UNEXPECTED_RESPONSE_CODE);
        assertEquals(503, ((InvalidResponseCodeFailure) failure).getResponseCode());
        assertTrue(registry.get("list_1").contains("abc"));
    }

    @Test
    public void fetchesForSeveralListsAllFinishBeforeReturning() {
        SpecsJson.CatalogBuilder catalog = SpecsJson.catalog();
        for (int i = 0; i < 10; i++) {
            String url = "https://cdn.example.com/many_" + i;
            catalog.list("many_" + i, 5, 1, url, "file_" + i);
            fetcher.setupRange(url, "+id" + i + "\n");
        }
        fetcher.setupCatalog(catalog.build());

        makeSynchronizer().reconcileCatalog();

        for (int i = 0; i < 10; i++) {
            IdList list = registry.get("many_" + i);
            assertEquals(5, list.getSize());
            assertTrue(list.contains("id" + i));
        }
    }
}
