package com.conductor.core.config;

import com.conductor.core.error.UnknownProjectException;
import com.conductor.core.model.Project;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectCatalogTest {

    private final Project alpha = new Project("alpha", "https://example.com/a.git", Path.of("/srv/alpha"));
    private final Project beta = new Project("beta", "https://example.com/b.git", Path.of("/srv/beta"));

    @Test
    void keepsConfigurationOrder() {
        var catalog = new ProjectCatalog(List.of(beta, alpha));
        assertEquals(List.of("beta", "alpha"), catalog.names());
    }

    @Test
    void requireListsAvailableProjectsWhenUnknown() {
        var catalog = new ProjectCatalog(List.of(alpha, beta));

        var e = assertThrows(UnknownProjectException.class, () -> catalog.require("gamma"));

        assertEquals("Unknown project: gamma. Available projects: alpha, beta", e.getMessage());
        assertEquals(UnknownProjectException.CODE, e.getCode());
    }

    @Test
    void findIsEmptyForNull() {
        assertTrue(new ProjectCatalog(List.of(alpha)).find(null).isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        var duplicate = new Project("alpha", "other", Path.of("/srv/other"));
        assertThrows(IllegalArgumentException.class, () -> new ProjectCatalog(List.of(alpha, duplicate)));
    }
}
