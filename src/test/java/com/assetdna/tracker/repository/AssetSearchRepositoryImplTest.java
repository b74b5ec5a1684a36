package com.assetdna.tracker.repository;

import com.assetdna.tracker.dto.asset.AssetSearchCriteria;
import com.assetdna.tracker.model.Asset;
import com.assetdna.tracker.model.AssetStatus;
import com.assetdna.tracker.model.AssetType;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetSearchRepositoryImplTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @InjectMocks
    private AssetSearchRepositoryImpl repository;

    @Test
    void onlySetFiltersBecomeCriteriaAndPagingIsApplied() {
        Asset radar = Asset.builder().id("radar").name("Radar").build();
        when(mongoTemplate.count(any(Query.class), eq(Asset.class))).thenReturn(12L);
        when(mongoTemplate.find(any(Query.class), eq(Asset.class))).thenReturn(List.of(radar));

        Page<Asset> page = repository.search(AssetSearchCriteria.builder()
                        .parentId("awacs")
                        .assetType(AssetType.SUBSYSTEM_SERVICE)
                        .status(AssetStatus.ACTIVE)
                        .nameContains(" ra.dar ")
                        .build(),
                PageRequest.of(1, 5, Sort.by("name")));

        assertThat(page.getContent()).containsExactly(radar);
        assertThat(page.getTotalElements()).isEqualTo(12);
        assertThat(page.getTotalPages()).isEqualTo(3);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Asset.class));
        Document filter = query.getValue().getQueryObject();
        assertThat(filter.get("parentId")).isEqualTo("awacs");
        assertThat(filter.get("assetType")).isEqualTo("SUBSYSTEM_SERVICE");
        assertThat(filter.get("status")).isEqualTo("ACTIVE");
        Pattern name = (Pattern) filter.get("name");
        assertThat(name.pattern()).isEqualTo(Pattern.quote("ra.dar"));
        assertThat(name.flags() & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(query.getValue().getSkip()).isEqualTo(5);
        assertThat(query.getValue().getLimit()).isEqualTo(5);
        assertThat(query.getValue().getSortObject().get("name")).isEqualTo(1);
    }

    @Test
    void emptyCriteriaMatchesEverythingAndSkipsFindWhenNothingMatches() {
        when(mongoTemplate.count(any(Query.class), eq(Asset.class))).thenReturn(0L);

        Page<Asset> page = repository.search(AssetSearchCriteria.builder().build(), PageRequest.of(0, 50));

        assertThat(page.getContent()).isEmpty();
        assertThat(page.getTotalElements()).isZero();
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).count(query.capture(), eq(Asset.class));
        assertThat(query.getValue().getQueryObject()).isEmpty();
        verify(mongoTemplate, never()).find(any(Query.class), eq(Asset.class));
    }
}
