package com.notesapi.db.util;

import static org.junit.jupiter.api.Assertions.*;

import com.notesapi.common.status.StatusCode;
import com.notesapi.common.status.StatusOr;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class ObjectIdsTest {

  @Test
  void testParse_ValidHex() {
    ObjectId expected = new ObjectId();

    StatusOr<ObjectId> result = ObjectIds.parse(expected.toHexString());

    assertTrue(result.isOk());
    assertEquals(expected, result.getValue());
  }

  @Test
  void testParse_UppercaseHex() {
    StatusOr<ObjectId> result = ObjectIds.parse("65F1C2A9E4B0A1B2C3D4E5F6");

    assertTrue(result.isOk());
    assertEquals("65f1c2a9e4b0a1b2c3d4e5f6", result.getValue().toHexString());
  }

  @Test
  void testParse_NullOrEmpty() {
    assertEquals(StatusCode.INVALID_ARGUMENT, ObjectIds.parse(null).getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, ObjectIds.parse("").getStatus().getCode());
  }

  @Test
  void testParse_Malformed() {
    // Too short, too long, and not hex.
    String[] malformed = {"abc", "65f1c2a9e4b0a1b2c3d4e5f600", "zzzzzzzzzzzzzzzzzzzzzzzz"};
    for (String bad : malformed) {
      StatusOr<ObjectId> result = ObjectIds.parse(bad);
      assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode(), bad);
      assertEquals("Invalid ID: " + bad, result.getStatus().getMessage());
    }
  }
}
