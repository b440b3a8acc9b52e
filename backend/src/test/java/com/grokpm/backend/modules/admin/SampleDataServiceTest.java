package com.grokpm.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import javax.sql.DataSource;

import com.grokpm.backend.modules.admin.application.SampleDataService;
import com.grokpm.backend.modules.property.infrastructure.persistence.PropertyRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

@ExtendWith(MockitoExtension.class)
class SampleDataServiceTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private PropertyRepository propertyRepository;

    @InjectMocks
    private SampleDataService sampleDataService;

    @Test
    void populatedDatabaseIsLeftAlone() {
        when(propertyRepository.count()).thenReturn(2L);

        boolean seeded = sampleDataService.seedIfEmpty();

        assertThat(seeded).isFalse();
        verifyNoInteractions(dataSource);
    }

    @Test
    void sampleScriptIsOnClasspath() {
        assertThat(new ClassPathResource("db/seed/sample_data.sql").exists()).isTrue();
    }
}
