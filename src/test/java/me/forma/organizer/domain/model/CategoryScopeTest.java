package me.forma.organizer.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryScopeTest {

    @Test
    void shouldContainEverythingWhenGlobal() {
        assertTrue(CategoryScope.global().contains("/anywhere/file.txt"));
        assertTrue(CategoryScope.global().couldOverlap(CategoryScope.folders(List.of("/tmp"))));
    }

    @Test
    void shouldMatchWholePathComponents() {
        CategoryScope scope = CategoryScope.folders(List.of("/Users/me/Downloads"));

        assertTrue(scope.contains("/Users/me/Downloads/report.pdf"));
        assertTrue(scope.contains("/Users/me/Downloads/nested/../report.pdf"));
        assertFalse(scope.contains("/Users/me/DownloadsOld/report.pdf"));
        assertFalse(scope.contains(null));
    }

    @Test
    void shouldOverlapOnlyForNestedOrEqualFolders() {
        CategoryScope desktop = CategoryScope.folders(List.of("/Users/me/Desktop"));

        assertTrue(desktop.couldOverlap(CategoryScope.folders(List.of("/Users/me/Desktop/Inbox"))));
        assertTrue(desktop.couldOverlap(CategoryScope.folders(List.of("/Users/me"))));
        assertFalse(desktop.couldOverlap(CategoryScope.folders(List.of("/Users/me/Documents", "/Volumes/USB"))));
    }

    @Test
    void shouldRejectEmptyFolderScope() {
        assertThrows(IllegalArgumentException.class, () -> CategoryScope.folders(List.of()));
    }
}
