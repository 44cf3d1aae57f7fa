package com.notesapi.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonSyntaxException;
import com.mongodb.MongoTimeoutException;
import com.notesapi.InMemoryNoteStore;
import com.notesapi.NoteServiceImpl;
import com.notesapi.db.NoteDraft;
import com.notesapi.db.SortOrder;
import com.notesapi.rest.dto.CreateNoteRequest;
import com.notesapi.rest.dto.GenericResponse;
import com.notesapi.rest.dto.ListNotesResponse;
import com.notesapi.rest.dto.Note;
import com.notesapi.rest.dto.NoteResponse;
import com.notesapi.rest.dto.UpdateNoteRequest;
import io.javalin.http.Context;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NoteServiceRestAdapterTest {

    @Mock
    private Context mockContext;

    private InMemoryNoteStore store;
    private NoteServiceImpl noteService;
    private NoteServiceRestAdapter adapter;

    @BeforeEach
    void setUp() {
        store = new InMemoryNoteStore();
        noteService = new NoteServiceImpl(new NoteServiceImpl.Config(
            store,
            10,
            100,
            SortOrder.ASCENDING,
            Clock.fixed(Instant.parse("2024-03-13T15:13:45Z"), ZoneOffset.UTC)));
        adapter = new NoteServiceRestAdapter(noteService);

        when(mockContext.status(anyInt())).thenReturn(mockContext);
        when(mockContext.json(any())).thenReturn(mockContext);
    }

    private Object capturedJson() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(mockContext).json(captor.capture());
        return captor.getValue();
    }

    private GenericResponse capturedError(int expectedStatus) {
        verify(mockContext).status(expectedStatus);
        Object body = capturedJson();
        assertInstanceOf(GenericResponse.class, body, "Error body should be a GenericResponse");
        GenericResponse response = (GenericResponse) body;
        assertEquals("fail", response.status());
        return response;
    }

    private String seed(String title) {
        return noteService.createNote(new NoteDraft(title, "seeded")).getValue().idHex();
    }

    @Test
    void testCreateNote_Returns201WithEnvelope() {
        // Setup mock context
        when(mockContext.bodyAsClass(CreateNoteRequest.class))
            .thenReturn(new CreateNoteRequest("Buy milk", "2%", null, null));

        // Act
        adapter.handleCreateNote(mockContext);

        // Verify response handling
        verify(mockContext).status(201);
        NoteResponse response = (NoteResponse) capturedJson();
        assertEquals("success", response.status());
        Note note = response.data();
        assertTrue(ObjectId.isValid(note.id()), "Id should be a 24 character hex string");
        assertEquals("Buy milk", note.title());
        assertEquals("2%", note.content());
        assertEquals("", note.category());
        assertEquals(Boolean.FALSE, note.published());
        assertEquals(Instant.parse("2024-03-13T15:13:45Z").toEpochMilli(), note.createdAt());
        assertEquals(note.createdAt(), note.updatedAt());
    }

    @Test
    void testCreateNote_MissingTitleIs400() {
        when(mockContext.bodyAsClass(CreateNoteRequest.class)).thenReturn(new CreateNoteRequest());

        adapter.handleCreateNote(mockContext);

        assertEquals("title is required", capturedError(400).message());
        assertEquals(0, store.callCount());
    }

    @Test
    void testCreateNote_MalformedBodyIs400() {
        when(mockContext.bodyAsClass(CreateNoteRequest.class))
            .thenThrow(new JsonSyntaxException("Expected BEGIN_OBJECT but was STRING"));

        adapter.handleCreateNote(mockContext);

        assertEquals("Invalid request body", capturedError(400).message());
    }

    @Test
    void testCreateNote_EmptyBodyIs400() {
        when(mockContext.bodyAsClass(CreateNoteRequest.class)).thenReturn(null);

        adapter.handleCreateNote(mockContext);

        assertEquals("Invalid request body", capturedError(400).message());
    }

    @Test
    void testCreateNote_DuplicateTitleIs409() {
        seed("Buy milk");
        when(mockContext.bodyAsClass(CreateNoteRequest.class))
            .thenReturn(new CreateNoteRequest("Buy milk", null, null, null));

        adapter.handleCreateNote(mockContext);

        assertEquals("A note with this title already exists", capturedError(409).message());
    }

    @Test
    void testGetNote_Found() {
        String id = seed("Readable");
        when(mockContext.pathParam("id")).thenReturn(id);

        adapter.handleGetNote(mockContext);

        NoteResponse response = (NoteResponse) capturedJson();
        assertEquals(id, response.data().id());
        assertEquals("Readable", response.data().title());
        verify(mockContext, never()).status(anyInt());
    }

    @Test
    void testGetNote_MalformedIdIs400() {
        when(mockContext.pathParam("id")).thenReturn("not-an-id");

        adapter.handleGetNote(mockContext);

        assertEquals("Invalid ID: not-an-id", capturedError(400).message());
        assertEquals(0, store.callCount());
    }

    @Test
    void testGetNote_UnknownIdIs404() {
        String id = new ObjectId().toHexString();
        when(mockContext.pathParam("id")).thenReturn(id);

        adapter.handleGetNote(mockContext);

        assertEquals("Note with ID: " + id + " not found", capturedError(404).message());
        verify(mockContext).attribute(RestAdapter.ERROR_RENDERED_ATTRIBUTE, Boolean.TRUE);
    }

    @Test
    void testGetNote_DatabaseTimeoutIs503() {
        String id = seed("Slow");
        store.failNextWith(new MongoTimeoutException("Timed out"));
        when(mockContext.pathParam("id")).thenReturn(id);

        adapter.handleGetNote(mockContext);

        assertEquals(
            "The database is unavailable, try again later", capturedError(503).message());
    }

    @Test
    void testGetNote_InternalFailureHidesDetails() {
        String id = seed("Broken");
        store.failNextWith(new IllegalStateException("secret driver detail"));
        when(mockContext.pathParam("id")).thenReturn(id);

        adapter.handleGetNote(mockContext);

        assertEquals("Internal server error", capturedError(500).message());
    }

    @Test
    void testUpdateNote_PartialUpdate() {
        String id = seed("Original");
        when(mockContext.pathParam("id")).thenReturn(id);
        when(mockContext.bodyAsClass(UpdateNoteRequest.class))
            .thenReturn(new UpdateNoteRequest(null, null, "work", true));

        adapter.handleUpdateNote(mockContext);

        Note note = ((NoteResponse) capturedJson()).data();
        assertEquals("Original", note.title());
        assertEquals("seeded", note.content());
        assertEquals("work", note.category());
        assertEquals(Boolean.TRUE, note.published());
    }

    @Test
    void testUpdateNote_EmptyBodyIs400() {
        String id = seed("Unchanged");
        when(mockContext.pathParam("id")).thenReturn(id);
        when(mockContext.bodyAsClass(UpdateNoteRequest.class)).thenReturn(new UpdateNoteRequest());

        adapter.handleUpdateNote(mockContext);

        assertEquals("No updatable fields provided", capturedError(400).message());
    }

    @Test
    void testDeleteNote_Returns204ThenNotFound() {
        String id = seed("Doomed");
        when(mockContext.pathParam("id")).thenReturn(id);

        adapter.handleDeleteNote(mockContext);

        verify(mockContext).status(204);
        verify(mockContext, never()).json(any());

        adapter.handleDeleteNote(mockContext);

        verify(mockContext).status(404);
    }

    @Test
    void testListNotes_DefaultsAndEnvelope() {
        seed("a");
        seed("b");

        adapter.handleListNotes(mockContext);

        ListNotesResponse response = (ListNotesResponse) capturedJson();
        assertEquals("success", response.status());
        assertEquals(2, response.results());
        assertEquals(2, response.data().size());
    }

    @Test
    void testListNotes_PageMapsToOffset() {
        for (int i = 0; i < 5; i++) {
            seed("note-" + i);
        }
        when(mockContext.queryParam("limit")).thenReturn("2");
        when(mockContext.queryParam("page")).thenReturn("3");

        adapter.handleListNotes(mockContext);

        ListNotesResponse response = (ListNotesResponse) capturedJson();
        assertEquals(1, response.results());
    }

    @Test
    void testListNotes_SortOrderDescending() {
        seed("first");
        seed("second");
        when(mockContext.queryParam("sort_order")).thenReturn("DESCENDING");

        adapter.handleListNotes(mockContext);

        ListNotesResponse response = (ListNotesResponse) capturedJson();
        // Both notes share a creation time, so the id breaks the tie.
        List<String> titles =
            response.data().stream().map(Note::title).collect(Collectors.toList());
        assertEquals(List.of("second", "first"), titles);
    }

    @Test
    void testListNotes_UnknownSortOrderIs400() {
        // Given a sort order that is neither ascending nor descending
        when(mockContext.queryParam("sort_order")).thenReturn("foo");

        // When the notes are listed
        adapter.handleListNotes(mockContext);

        // Then the request is rejected without a fallback to the default order
        assertEquals(
            "sort_order must be ASCENDING or DESCENDING but was 'foo'",
            capturedError(400).message());
        assertEquals(0, store.callCount());
    }

    @Test
    void testListNotes_NonNumericLimitIs400() {
        when(mockContext.queryParam("limit")).thenReturn("ten");

        adapter.handleListNotes(mockContext);

        assertTrue(capturedError(400).message().contains("limit"));
        assertEquals(0, store.callCount());
    }

    @Test
    void testListNotes_LimitOutOfRangeIs400() {
        when(mockContext.queryParam("limit")).thenReturn("101");

        adapter.handleListNotes(mockContext);

        assertEquals("limit must be between 1 and 100", capturedError(400).message());
    }

    @Test
    void testListNotes_PageAndOffsetTogetherIs400() {
        when(mockContext.queryParam("page")).thenReturn("1");
        when(mockContext.queryParam("offset")).thenReturn("0");

        adapter.handleListNotes(mockContext);

        capturedError(400);
        assertEquals(0, store.callCount());
    }

    @Test
    void testListNotes_PageBelowOneIs400() {
        when(mockContext.queryParam("page")).thenReturn("0");

        adapter.handleListNotes(mockContext);

        assertEquals("page must be at least 1", capturedError(400).message());
    }
}
