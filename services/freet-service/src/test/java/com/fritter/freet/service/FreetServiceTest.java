package com.fritter.freet.service;

import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FritterUser;
import com.fritter.freet.exception.FreetModificationForbiddenException;
import com.fritter.freet.exception.FreetNotFoundException;
import com.fritter.freet.exception.InvalidFreetContentException;
import com.fritter.freet.exception.UserNotFoundException;
import com.fritter.freet.repository.FreetReportRepository;
import com.fritter.freet.repository.FreetRepository;
import com.fritter.freet.repository.FreetVoteRepository;
import com.fritter.freet.repository.FritterUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FreetService Unit Tests")
class FreetServiceTest {

    private static final UUID AUTHOR_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID OTHER_USER_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
    private static final UUID FREET_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final Instant CREATED = Instant.parse("2024-05-01T08:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private FreetRepository freetRepository;

    @Mock
    private FritterUserRepository userRepository;

    @Mock
    private FreetVoteRepository voteRepository;

    @Mock
    private FreetReportRepository reportRepository;

    private FreetService freetService;
    private Freet freet;

    @BeforeEach
    void setUp() {
        freetService = new FreetService(freetRepository, userRepository, voteRepository, reportRepository,
            new FritterProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        freet = Freet.builder()
                .id(FREET_ID)
                .authorId(AUTHOR_ID)
                .content("Original")
                .createdAt(CREATED)
                .modifiedAt(CREATED)
                .build();
    }

    @Nested
    @DisplayName("Create Freet Tests")
    class CreateFreetTests {

        @Test
        @DisplayName("Should store trimmed content with creation and modification time")
        void shouldCreateFreet() {
            // Arrange
            when(userRepository.existsById(AUTHOR_ID)).thenReturn(true);
            when(freetRepository.save(any(Freet.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            Freet created = freetService.createFreet(AUTHOR_ID, "  Hello Fritter!  ");

            // Assert
            assertThat(created.getContent()).isEqualTo("Hello Fritter!");
            assertThat(created.getCreatedAt()).isEqualTo(NOW);
            assertThat(created.getModifiedAt()).isEqualTo(NOW);
            assertThat(created.getUpvotes()).isZero();
            assertThat(created.getAuthorId()).isEqualTo(AUTHOR_ID);
        }

        @Test
        @DisplayName("Should accept exactly 140 characters")
        void shouldAcceptMaximumLength() {
            when(userRepository.existsById(AUTHOR_ID)).thenReturn(true);
            when(freetRepository.save(any(Freet.class))).thenAnswer(inv -> inv.getArgument(0));

            Freet created = freetService.createFreet(AUTHOR_ID, "x".repeat(140));

            assertThat(created.getContent()).hasSize(140);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("Should reject blank content")
        void shouldRejectBlankContent(String content) {
            assertThatThrownBy(() -> freetService.createFreet(AUTHOR_ID, content))
                    .isInstanceOf(InvalidFreetContentException.class)
                    .hasMessage("Freet content must be at least one character long.");
            verifyNoInteractions(freetRepository);
        }

        @Test
        @DisplayName("Should reject content over 140 characters")
        void shouldRejectLongContent() {
            assertThatThrownBy(() -> freetService.createFreet(AUTHOR_ID, "x".repeat(141)))
                    .isInstanceOf(InvalidFreetContentException.class)
                    .hasMessage("Freet content must be no more than 140 characters.");
        }

        @Test
        @DisplayName("Should reject unknown authors")
        void shouldRejectUnknownAuthor() {
            when(userRepository.existsById(AUTHOR_ID)).thenReturn(false);

            assertThatThrownBy(() -> freetService.createFreet(AUTHOR_ID, "hello"))
                    .isInstanceOf(UserNotFoundException.class);
            verify(freetRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("Should throw when the freet does not exist")
        void shouldThrowForMissingFreet() {
            when(freetRepository.findById(FREET_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> freetService.getFreet(FREET_ID))
                    .isInstanceOf(FreetNotFoundException.class);
        }

        @Test
        @DisplayName("Should list an author's freets by username")
        void shouldListByUsername() {
            FritterUser author = FritterUser.builder().id(AUTHOR_ID).username("alice").build();
            when(userRepository.findByUsername("alice")).thenReturn(Optional.of(author));
            when(freetRepository.findByAuthorIdOrderByModifiedAtDesc(AUTHOR_ID)).thenReturn(List.of(freet));

            assertThat(freetService.findAllByUsername("alice")).containsExactly(freet);
        }

        @Test
        @DisplayName("Should reject unknown usernames")
        void shouldRejectUnknownUsername() {
            when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> freetService.findAllByUsername("ghost"))
                    .isInstanceOf(UserNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Modification Tests")
    class ModificationTests {

        @Test
        @DisplayName("Author should be able to edit content")
        void authorShouldEdit() {
            // Arrange
            when(freetRepository.findByIdForUpdate(FREET_ID)).thenReturn(Optional.of(freet));
            when(freetRepository.save(any(Freet.class))).thenAnswer(inv -> inv.getArgument(0));

            // Act
            Freet updated = freetService.updateFreet(FREET_ID, AUTHOR_ID, "Edited");

            // Assert
            assertThat(updated.getContent()).isEqualTo("Edited");
            assertThat(updated.getModifiedAt()).isEqualTo(NOW);
            assertThat(updated.getCreatedAt()).isEqualTo(CREATED);
        }

        @Test
        @DisplayName("Others should not be able to edit")
        void othersShouldNotEdit() {
            when(freetRepository.findByIdForUpdate(FREET_ID)).thenReturn(Optional.of(freet));

            assertThatThrownBy(() -> freetService.updateFreet(FREET_ID, OTHER_USER_ID, "Hijacked"))
                    .isInstanceOf(FreetModificationForbiddenException.class);
            assertThat(freet.getContent()).isEqualTo("Original");
            verify(freetRepository, never()).save(any());
        }

        @Test
        @DisplayName("Deleting should purge ledgers before the freet")
        void deleteShouldPurgeLedgers() {
            // Arrange
            when(freetRepository.findByIdForUpdate(FREET_ID)).thenReturn(Optional.of(freet));

            // Act
            freetService.deleteFreet(FREET_ID, AUTHOR_ID);

            // Assert
            InOrder inOrder = inOrder(voteRepository, reportRepository, freetRepository);
            inOrder.verify(voteRepository).deleteAllByFreetId(FREET_ID);
            inOrder.verify(reportRepository).deleteAllByFreetId(FREET_ID);
            inOrder.verify(freetRepository).delete(freet);
        }

        @Test
        @DisplayName("Others should not be able to delete")
        void othersShouldNotDelete() {
            when(freetRepository.findByIdForUpdate(FREET_ID)).thenReturn(Optional.of(freet));

            assertThatThrownBy(() -> freetService.deleteFreet(FREET_ID, OTHER_USER_ID))
                    .isInstanceOf(FreetModificationForbiddenException.class);
            verify(freetRepository, never()).delete(any());
        }

        @Test
        @DisplayName("Should delete every freet of an author")
        void shouldDeleteAllByAuthor() {
            Freet second = Freet.builder().id(UUID.randomUUID()).authorId(AUTHOR_ID).content("2").build();
            when(freetRepository.findByAuthorId(AUTHOR_ID)).thenReturn(List.of(freet, second));

            int deleted = freetService.deleteAllByAuthor(AUTHOR_ID);

            assertThat(deleted).isEqualTo(2);
            ArgumentCaptor<Freet> captor = ArgumentCaptor.forClass(Freet.class);
            verify(freetRepository, times(2)).delete(captor.capture());
            assertThat(captor.getAllValues()).containsExactly(freet, second);
        }
    }
}
