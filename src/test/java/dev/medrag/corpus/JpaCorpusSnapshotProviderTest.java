package dev.medrag.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.SliceImpl;
import org.springframework.data.domain.Sort;

@ExtendWith(MockitoExtension.class)
class JpaCorpusSnapshotProviderTest {

  private static final UUID ROW_ID = UUID.fromString("3f2a8c1e-5b7d-4e9a-8c21-0d6f4b3a9e17");

  @Mock MedicalDocumentRepository repository;

  private JpaCorpusSnapshotProvider provider;

  @BeforeEach
  void setUp() {
    provider = new JpaCorpusSnapshotProvider(repository, new ObjectMapper());
  }

  @Test
  void fetchPageRequestsStableOrder() {
    given(repository.findAllBy(any()))
        .willReturn(new SliceImpl<>(List.of(row("{}")), PageRequest.of(2, 1), true));

    CorpusPage page = provider.fetchPage(2, 1);

    ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
    verify(repository).findAllBy(pageable.capture());
    assertThat(pageable.getValue().getPageNumber()).isEqualTo(2);
    assertThat(pageable.getValue().getPageSize()).isEqualTo(1);
    assertThat(pageable.getValue().getSort()).isEqualTo(Sort.by("id"));
    assertThat(page.last()).isFalse();
    assertThat(page.documents()).hasSize(1);
  }

  @Test
  void lastSliceIsReportedAsLast() {
    given(repository.findAllBy(any()))
        .willReturn(new SliceImpl<>(List.of(), PageRequest.of(0, 10), false));

    CorpusPage page = provider.fetchPage(0, 10);

    assertThat(page.last()).isTrue();
    assertThat(page.documents()).isEmpty();
  }

  @Test
  void metadataIdAndFieldsAreUsed() {
    CorpusDocument document =
        provider.toCorpusDocument(
            row("{\"id\":\"med-0001\",\"name\":\"感冒\",\"content\":\"dup\",\"cure_way\":\"药物治疗\"}"));

    assertThat(document.id()).isEqualTo("med-0001");
    assertThat(document.content()).isEqualTo("感冒 发热 咳嗽");
    assertThat(document.fields()).containsOnlyKeys("name", "cure_way");
  }

  @Test
  void embeddingIdIsUsedWithoutMetadataId() {
    CorpusDocument document = provider.toCorpusDocument(row(null));

    assertThat(document.id()).isEqualTo(ROW_ID.toString());
    assertThat(document.fields()).isEmpty();
  }

  @Test
  void unreadableMetadataKeepsTheText() {
    CorpusDocument document = provider.toCorpusDocument(row("{not json"));

    assertThat(document.content()).isEqualTo("感冒 发热 咳嗽");
    assertThat(document.fields()).isEmpty();
  }

  private static MedicalDocument row(String metadata) {
    return new MedicalDocument(ROW_ID, "感冒 发热 咳嗽", metadata);
  }
}
