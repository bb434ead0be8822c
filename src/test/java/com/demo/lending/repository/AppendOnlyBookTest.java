package com.demo.lending.repository;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppendOnlyBookTest {

    private final AppendOnlyBook<String> book = new AppendOnlyBook<>();

    @Test
    void tombstoneKeepsIdsInPlace() {
        long a = book.append("a");
        long b = book.append("b");
        book.tombstone(a);
        long c = book.append("c");

        assertThat(a).isEqualTo(0L);
        assertThat(b).isEqualTo(1L);
        assertThat(c).isEqualTo(2L);
        assertThat(book.find(a)).isEmpty();
        assertThat(book.find(b)).contains("b");
        assertThat(book.size()).isEqualTo(3L);
    }

    @Test
    void discardReleasesOnlyTheTail() {
        long a = book.append("a");
        long b = book.append("b");

        book.discard(b);
        assertThat(book.size()).isEqualTo(1L);

        book.discard(a);
        assertThat(book.size()).isZero();
    }

    @Test
    void discardInsideTheBookTombstones() {
        long a = book.append("a");
        book.append("b");

        book.discard(a);

        assertThat(book.size()).isEqualTo(2L);
        assertThat(book.isOpen(a)).isFalse();
    }

    @Test
    void unknownIdsAreAbsent() {
        assertThat(book.find(-1)).isEmpty();
        assertThat(book.find(5)).isEmpty();
        assertThatThrownBy(() -> book.replace(5, "x")).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
