package com.mk.fx.qa.login.load.session;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CredentialTest {

  @Test
  void parse_splitsAtFirstColon() {
    var credential = Credential.parse("bob:pa:ss");

    assertEquals("bob", credential.username());
    assertEquals("pa:ss", credential.password());
  }

  @Test
  void parse_allowsEmptyPassword() {
    assertEquals("", Credential.parse("bob:").password());
  }

  @Test
  void parse_rejectsMissingSeparatorOrBlank() {
    assertThrows(IllegalArgumentException.class, () -> Credential.parse("bob"));
    assertThrows(IllegalArgumentException.class, () -> Credential.parse("  "));
    assertThrows(IllegalArgumentException.class, () -> Credential.parse(null));
  }

  @Test
  void toString_neverExposesPassword() {
    assertFalse(new Credential("bob", "hunter2").toString().contains("hunter2"));
  }
}
