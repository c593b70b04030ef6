package com.github.simbo1905.fio;

import static com.github.simbo1905.fio.CharacterMode.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.Test;

public class CharacterModeTest extends JulLoggingConfig {

  @Test
  public void unorientedTakesWhatIsRequested() {
    assertThat(NO_ORIENTATION.transitionTo(BYTE_ORIENTATION), is(BYTE_ORIENTATION));
    assertThat(NO_ORIENTATION.transitionTo(WIDE_ORIENTATION), is(WIDE_ORIENTATION));
    assertThat(NO_ORIENTATION.transitionTo(NO_ORIENTATION), is(NO_ORIENTATION));
  }

  @Test
  public void committedNeverMoves() {
    for (CharacterMode desired : values()) {
      assertThat(BYTE_ORIENTATION.transitionTo(desired), is(BYTE_ORIENTATION));
      assertThat(WIDE_ORIENTATION.transitionTo(desired), is(WIDE_ORIENTATION));
    }
  }

  @Test
  public void valuesFollowFwide() {
    assertThat(BYTE_ORIENTATION.getValue() < 0, is(true));
    assertThat(NO_ORIENTATION.getValue(), is(0));
    assertThat(WIDE_ORIENTATION.getValue() > 0, is(true));
  }
}
