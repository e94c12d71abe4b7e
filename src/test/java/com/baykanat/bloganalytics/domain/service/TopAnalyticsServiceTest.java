package com.baykanat.bloganalytics.domain.service;

import com.baykanat.bloganalytics.config.AppProperties;
import com.baykanat.bloganalytics.domain.exception.InvalidDateException;
import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;
import com.baykanat.bloganalytics.domain.exception.UnsupportedDimensionException;
import com.baykanat.bloganalytics.domain.filter.FilterCompiler;
import com.baykanat.bloganalytics.domain.model.AnalyticsDimension;
import com.baykanat.bloganalytics.domain.model.TimeRange;
import com.baykanat.bloganalytics.domain.model.TopEntry;
import com.baykanat.bloganalytics.infrastructure.persistence.ViewAnalyticsJdbcRepository;
import com.baykanat.bloganalytics.infrastructure.persistence.filter.SqlFragment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TopAnalyticsServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ViewAnalyticsJdbcRepository viewAnalyticsRepository;

    private TopAnalyticsService service;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getAnalytics().setDefaultTopLimit(10);
        properties.getAnalytics().setMaxTopLimit(100);
        service = new TopAnalyticsService(viewAnalyticsRepository, new AnalyticsFilters(new FilterCompiler()), properties);
    }

    @Test
    @DisplayName("Dimension aliases resolve and the limit defaults to the configured value")
    void resolvesDimensionAndDefaultLimit() {
        List<TopEntry> expected = List.of(new TopEntry("Post A", 1L, 5L));
        when(viewAnalyticsRepository.findTop(eq(AnalyticsDimension.BLOG), isNull(), eq(new TimeRange(null, null)), eq(10)))
                .thenReturn(expected);

        assertThat(service.top("item", null, null, null, null)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Limits above the maximum are capped")
    void capsLimit() {
        when(viewAnalyticsRepository.findTop(any(), any(), any(), anyInt())).thenReturn(List.of());

        service.top("country", null, "2025-01-01", "2025-01-31", 5000);

        verify(viewAnalyticsRepository).findTop(AnalyticsDimension.COUNTRY, null,
                new TimeRange(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)), 100);
    }

    @Test
    @DisplayName("Filters are rendered against the raw view query")
    void rendersFilter() throws Exception {
        when(viewAnalyticsRepository.findTop(any(), any(), any(), anyInt())).thenReturn(List.of());

        service.top("user", objectMapper.readTree("{\"contains\": {\"field\": \"author.username\", \"value\": \"ann\"}}"),
                null, null, 3);

        ArgumentCaptor<SqlFragment> filter = ArgumentCaptor.forClass(SqlFragment.class);
        verify(viewAnalyticsRepository).findTop(eq(AnalyticsDimension.USER), filter.capture(), any(), eq(3));
        assertThat(filter.getValue().getSql()).isEqualTo("u.username ILIKE ? ESCAPE '\\'");
    }

    @Test
    @DisplayName("Bad dimension, date or filter fail before the repository is called")
    void validatesBeforeQuerying() throws Exception {
        assertThatThrownBy(() -> service.top("planet", null, null, null, null))
                .isInstanceOf(UnsupportedDimensionException.class);
        assertThatThrownBy(() -> service.top("blog", null, "2025-13-01", null, null))
                .isInstanceOf(InvalidDateException.class);
        assertThatThrownBy(() -> service.top("blog", objectMapper.readTree("{\"additionalProp1\": {}}"), null, null, null))
                .isInstanceOf(InvalidFilterException.class);
        verifyNoInteractions(viewAnalyticsRepository);
    }
}
