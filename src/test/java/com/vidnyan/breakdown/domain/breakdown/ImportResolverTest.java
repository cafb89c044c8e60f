package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.UnsupportedDialectException;
import com.vidnyan.breakdown.domain.node.SourceDialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImportResolverTest {

    private final ImportResolver resolver = new ImportResolver();

    @Test
    void resolve_KotlinSourceRoot_ShouldUseDirectoryPackage() {
        String result = resolver.resolve(
                "/home/dev/app/src/main/kotlin/com/example/views/MainView.kt", "ignored.pkg", "MainView");

        assertEquals("com.example.views.MainView", result);
    }

    @Test
    void resolve_WindowsJavaPath_ShouldUseDirectoryPackage() {
        String result = resolver.resolve("C:\\work\\app\\src\\main\\java\\org\\demo\\App.java", null, "App");

        assertEquals("org.demo.App", result);
    }

    @Test
    void resolve_TestRoot_ShouldUseDirectoryPackage() {
        assertEquals("com.x.FooTest", resolver.resolve("src/test/kotlin/com/x/FooTest.kt", null, "FooTest"));
    }

    @Test
    void resolve_FileDirectlyUnderRoot_ShouldHaveNoPackage() {
        assertEquals("App", resolver.resolve("src/main/kotlin/App.kt", "declared", "App"));
    }

    @Test
    void resolve_WithoutSourceRoot_ShouldFallBackToDeclaredPackage() {
        assertEquals("com.acme.View", resolver.resolve("scratch/View.kts", "com.acme", "View"));
        assertEquals("View", resolver.resolve("scratch/View.kt", null, "View"));
    }

    @Test
    void resolve_UnknownExtension_ShouldThrow() {
        UnsupportedDialectException e = assertThrows(UnsupportedDialectException.class,
                () -> resolver.resolve("tools/build.py", null, "Build"));

        assertEquals("tools/build.py", e.getPath());
    }

    @Test
    void fromPath_ShouldDetectDialect() {
        assertEquals(SourceDialect.KOTLIN, SourceDialect.fromPath("a/B.kt"));
        assertEquals(SourceDialect.KOTLIN, SourceDialect.fromPath("build.gradle.kts"));
        assertEquals(SourceDialect.JAVA, SourceDialect.fromPath("a/B.JAVA"));
        assertThrows(UnsupportedDialectException.class, () -> SourceDialect.fromPath(null));
    }

    @Test
    void resolve_LanguageNamedDirectoryOutsideSourceRoot_ShouldKeepDeclaredPackage() {
        assertEquals("com.acme.Main",
                resolver.resolve("/Users/me/java/myrepo/src/com/acme/Main.java", "com.acme", "Main"));
        assertEquals("com.acme.app.Main",
                resolver.resolve("/home/dev/kotlin/tools/app/Main.kt", "com.acme.app", "Main"));
    }

    @Test
    void resolve_BareRootWithoutDeclaredPackage_ShouldUseDirectoryPackage() {
        assertEquals("tools.app.Main", resolver.resolve("/home/dev/kotlin/tools/app/Main.kt", " ", "Main"));
        assertEquals("a.b.C", resolver.resolve("java/a/b/C.java", null, "C"));
    }

    @Test
    void packageFromPath_WithoutSourceRoot_ShouldBeNull() {
        assertNull(ImportResolver.packageFromPath("lib/Thing.java", SourceDialect.JAVA));
        assertNull(ImportResolver.packageFromPath("java/a/b/C.java", SourceDialect.JAVA));
        assertEquals("a.b", ImportResolver.packageFromPath("mod/src/test/java/a/b/C.java", SourceDialect.JAVA));
    }
}
