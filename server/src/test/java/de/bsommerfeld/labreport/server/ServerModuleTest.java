package de.bsommerfeld.labreport.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.labreport.core.config.ApplicationMode;
import de.bsommerfeld.labreport.core.config.GlobalConfig;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.core.event.TopicChangeNotifier;
import de.bsommerfeld.labreport.db.DatabaseService;
import de.bsommerfeld.labreport.db.InMemoryDatabaseService;
import de.bsommerfeld.labreport.db.SqlDatabaseService;
import de.bsommerfeld.labreport.server.http.HttpServerInitializer;
import de.bsommerfeld.labreport.service.DocumentService;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ServerModuleTest {

    @TempDir
    Path tempDir;

    private Injector injector(ApplicationMode mode) {
        GlobalConfig config = new GlobalConfig();
        config.getAuth().setJwtSecret("test-secret");
        config.getDatabase().setPath(tempDir.resolve("labreport.db").toString());
        return Guice.createInjector(new ServerModule(config, mode));
    }

    @Test
    void testMode_shouldBindInMemoryStore() {
        assertInstanceOf(InMemoryDatabaseService.class, injector(ApplicationMode.TEST).getInstance(DatabaseService.class));
    }

    @Test
    void prodMode_shouldBindSqliteStore() {
        assertInstanceOf(SqlDatabaseService.class, injector(ApplicationMode.PROD).getInstance(DatabaseService.class));
    }

    @Test
    void notifier_shouldBeSharedSingleton() {
        Injector injector = injector(ApplicationMode.TEST);
        ChangeNotifier notifier = injector.getInstance(ChangeNotifier.class);

        assertInstanceOf(TopicChangeNotifier.class, notifier);
        assertSame(notifier, injector.getInstance(ChangeNotifier.class));
    }

    @Test
    void changeLogListener_shouldSeePublishedChanges() {
        Injector injector = injector(ApplicationMode.TEST);
        injector.getInstance(DatabaseService.class).insertUser(new User("alice", "hash", Instant.now()));
        DocumentService documents = injector.getInstance(DocumentService.class);

        String reportId = documents.createReport(new ReportFields("L1", "S", "A"), "alice").id();
        documents.updateReport(reportId, new ReportFields("L2", "S", "A"));
        documents.deleteReport(reportId);

        assertEquals(2, injector.getInstance(ChangeLogListener.class).publishedCount());
    }

    @Test
    void initializer_shouldAssembleHttpAndWebSocketPipeline() {
        HttpServerInitializer initializer = injector(ApplicationMode.TEST).getInstance(HttpServerInitializer.class);
        EmbeddedChannel channel = new EmbeddedChannel(initializer);
        try {
            assertNotNull(channel.pipeline().get(HttpServerCodec.class));
            assertNotNull(channel.pipeline().get(HttpObjectAggregator.class));
            assertNotNull(channel.pipeline().get(CorsHandler.class));
            assertNotNull(channel.pipeline().get(WebSocketServerProtocolHandler.class));
        } finally {
            channel.finishAndReleaseAll();
            initializer.handlerGroup().shutdownGracefully();
        }
    }
}
