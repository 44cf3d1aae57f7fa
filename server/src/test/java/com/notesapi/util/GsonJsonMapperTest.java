package com.notesapi.util;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonSyntaxException;
import com.notesapi.rest.dto.CreateNoteRequest;
import com.notesapi.rest.dto.GenericResponse;
import com.notesapi.rest.dto.Note;
import com.notesapi.rest.dto.NoteResponse;
import com.notesapi.rest.dto.UpdateNoteRequest;
import org.junit.jupiter.api.Test;

class GsonJsonMapperTest {

  private final GsonJsonMapper mapper = new GsonJsonMapper();

  @Test
  void testToJsonString_Envelope() {
    NoteResponse response =
        NoteResponse.success(
            new Note("65f1c2a9e4b0a1b2c3d4e5f6", "Buy <milk>", null, "", false, 1L, 2L));

    String json = mapper.toJsonString(response, NoteResponse.class);

    assertEquals(
        "{\"status\":\"success\",\"data\":{\"id\":\"65f1c2a9e4b0a1b2c3d4e5f6\","
            + "\"title\":\"Buy <milk>\",\"category\":\"\",\"published\":false,"
            + "\"createdAt\":1,\"updatedAt\":2}}",
        json);
  }

  @Test
  void testToJsonString_FailEnvelope() {
    String json =
        mapper.toJsonString(GenericResponse.fail("Invalid ID: x"), GenericResponse.class);

    assertEquals("{\"status\":\"fail\",\"message\":\"Invalid ID: x\"}", json);
  }

  @Test
  void testFromJsonString_NullAndAbsentAreEquivalent() {
    UpdateNoteRequest absent =
        mapper.fromJsonString("{\"content\":\"2%\"}", UpdateNoteRequest.class);
    UpdateNoteRequest explicitNull =
        mapper.fromJsonString("{\"content\":\"2%\",\"title\":null}", UpdateNoteRequest.class);

    assertEquals(absent, explicitNull);
    assertNull(absent.title());
    assertEquals("2%", absent.content());
  }

  @Test
  void testFromJsonString_CreateRequest() {
    CreateNoteRequest request =
        mapper.fromJsonString(
            "{\"title\":\"Buy milk\",\"published\":true,\"unknown\":1}", CreateNoteRequest.class);

    assertEquals("Buy milk", request.title());
    assertEquals(Boolean.TRUE, request.published());
    assertNull(request.category());
  }

  @Test
  void testFromJsonString_MalformedJsonThrows() {
    assertThrows(
        JsonSyntaxException.class,
        () -> mapper.fromJsonString("{\"title\": ", CreateNoteRequest.class));
  }

  @Test
  void testFromJsonString_StringForBooleanIsRejected() {
    assertThrows(
        JsonSyntaxException.class,
        () -> mapper.fromJsonString("{\"published\":\"yes\"}", UpdateNoteRequest.class));
  }

  @Test
  void testFromJsonString_NumberForTitleIsRejected() {
    assertThrows(
        JsonSyntaxException.class,
        () -> mapper.fromJsonString("{\"title\":123}", CreateNoteRequest.class));
  }

  @Test
  void testFromJsonString_BooleanForCategoryIsRejected() {
    assertThrows(
        JsonSyntaxException.class,
        () ->
            mapper.fromJsonString(
                "{\"title\":\"t\",\"category\":true}", CreateNoteRequest.class));
  }
}
