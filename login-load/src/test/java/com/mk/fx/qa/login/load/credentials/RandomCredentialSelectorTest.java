package com.mk.fx.qa.login.load.credentials;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.login.load.session.Credential;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RandomCredentialSelectorTest {

  private static final Credential ALICE = new Credential("alice", "a");
  private static final Credential BOB = new Credential("bob", "b");
  private static final Credential CAROL = new Credential("carol", "c");

  @Test
  void singleCredentialPool_alwaysReturnsIt() {
    var selector = new RandomCredentialSelector(List.of(ALICE), new Random());
    for (int i = 0; i < 50; i++) {
      assertSame(ALICE, selector.next());
    }
    assertEquals(1, selector.poolSize());
  }

  @Test
  void emptyPool_isRejected() {
    var ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> new RandomCredentialSelector(List.of(), new Random()));
    assertTrue(ex.getMessage().contains("at least 1 user"));
  }

  @Test
  void selectsOnlyFromPool_andEventuallyUsesEveryEntry() {
    var pool = List.of(ALICE, BOB, CAROL);
    var selector = RandomCredentialSelector.of(pool, 7L);
    var seen = new HashSet<Credential>();
    for (int i = 0; i < 300; i++) {
      var credential = selector.next();
      assertTrue(pool.contains(credential));
      seen.add(credential);
    }
    assertEquals(3, seen.size());
  }

  @Test
  void sameSeed_producesSameSequence() {
    var pool = List.of(ALICE, BOB, CAROL);
    var first = RandomCredentialSelector.of(pool, 42L);
    var second = RandomCredentialSelector.of(pool, 42L);
    for (int i = 0; i < 20; i++) {
      assertEquals(first.next(), second.next());
    }
  }

  @Test
  void poolIsCopied_laterChangesToSourceAreIgnored() {
    var source = new ArrayList<>(List.of(ALICE));
    var selector = new RandomCredentialSelector(source, new Random(1));
    source.clear();
    source.add(BOB);
    assertSame(ALICE, selector.next());
    assertEquals(1, selector.poolSize());
  }
}
