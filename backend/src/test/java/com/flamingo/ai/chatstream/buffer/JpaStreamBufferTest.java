package com.flamingo.ai.chatstream.buffer;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chatstream.domain.enums.EntryKind;
import com.flamingo.ai.chatstream.domain.repository.BufferEntryRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class JpaStreamBufferTest {

  @Autowired private BufferEntryRepository bufferEntryRepository;

  private JpaStreamBuffer buffer;

  @BeforeEach
  void setUp() {
    buffer = new JpaStreamBuffer(bufferEntryRepository);
  }

  @Test
  void shouldAssignGaplessOffsets_andReadAfterOffset() {
    // When
    long first = buffer.append("s1", EntryKind.TEXT, "Hel");
    long second = buffer.append("s1", EntryKind.TEXT, "lo");
    long third = buffer.append("s1", EntryKind.DONE, null);

    // Then
    assertThat(List.of(first, second, third)).containsExactly(1L, 2L, 3L);
    assertThat(buffer.readFrom("s1", 1, 100))
        .containsExactly(
            new StreamEntry("s1", 2, EntryKind.TEXT, "lo"),
            new StreamEntry("s1", 3, EntryKind.DONE, null));
  }

  @Test
  void shouldKeepStreamsIndependent() {
    buffer.append("a", EntryKind.TEXT, "x");
    buffer.append("b", EntryKind.TEXT, "y");

    assertThat(buffer.append("a", EntryKind.TEXT, "z")).isEqualTo(2);
    assertThat(buffer.readFrom("b", 0, 100)).extracting(StreamEntry::payload).containsExactly("y");
  }

  @Test
  void shouldHonourReadLimit() {
    for (int i = 0; i < 5; i++) {
      buffer.append("s1", EntryKind.TEXT, "t" + i);
    }

    assertThat(buffer.readFrom("s1", 0, 2)).extracting(StreamEntry::offset).containsExactly(1L, 2L);
    assertThat(buffer.readFrom("s1", 4, 2)).extracting(StreamEntry::offset).containsExactly(5L);
  }

  @Test
  void shouldContinueFromStoredOffset_onAnotherWriterInstance() {
    buffer.append("s1", EntryKind.TEXT, "a");
    buffer.append("s1", EntryKind.TEXT, "b");

    JpaStreamBuffer other = new JpaStreamBuffer(bufferEntryRepository);

    assertThat(other.append("s1", EntryKind.TEXT, "c")).isEqualTo(3);
  }

  @Test
  void shouldDeleteEntries_whenExpired() {
    buffer.append("s1", EntryKind.TEXT, "a");
    buffer.append("s1", EntryKind.DONE, null);

    buffer.expire("s1");

    assertThat(buffer.readFrom("s1", 0, 100)).isEmpty();
    assertThat(bufferEntryRepository.findLastSeq("s1")).isZero();
  }
}
