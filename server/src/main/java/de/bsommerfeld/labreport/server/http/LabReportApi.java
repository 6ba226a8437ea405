package de.bsommerfeld.labreport.server.http;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.domain.QuestionFields;
import de.bsommerfeld.labreport.core.domain.ReportFields;
import de.bsommerfeld.labreport.core.domain.SubtopicFields;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.service.DocumentService;
import de.bsommerfeld.labreport.service.auth.AuthService;

import java.time.Instant;
import java.util.Map;

import static io.netty.handler.codec.http.HttpMethod.DELETE;
import static io.netty.handler.codec.http.HttpMethod.GET;
import static io.netty.handler.codec.http.HttpMethod.POST;
import static io.netty.handler.codec.http.HttpMethod.PUT;

/**
 * REST surface of the application. Each route decodes its body, calls the
 * document or auth service and picks the success status. Errors travel as
 * exceptions to {@link ApiRequestHandler}.
 *
 * <pre>
 * GET    /api/health
 * POST   /api/auth/register
 * POST   /api/auth/login
 * GET    /api/lab-reports                                        (auth)
 * POST   /api/lab-reports                                        (auth)
 * GET    /api/lab-reports/{r}                                    (auth)
 * PUT    /api/lab-reports/{r}                                    (auth)
 * DELETE /api/lab-reports/{r}                                    (auth)
 * POST   /api/lab-reports/{r}/questions                          (auth)
 * PUT    /api/lab-reports/{r}/questions/{q}                      (auth)
 * DELETE /api/lab-reports/{r}/questions/{q}                      (auth)
 * POST   /api/lab-reports/{r}/questions/{q}/subtopics            (auth)
 * PUT    /api/lab-reports/{r}/questions/{q}/subtopics/{s}        (auth)
 * DELETE /api/lab-reports/{r}/questions/{q}/subtopics/{s}        (auth)
 * </pre>
 */
@Singleton
public class LabReportApi {

    private static final String REPORTS = "/api/lab-reports";
    private static final String REPORT = REPORTS + "/{reportId}";
    private static final String QUESTIONS = REPORT + "/questions";
    private static final String QUESTION = QUESTIONS + "/{questionId}";
    private static final String SUBTOPICS = QUESTION + "/subtopics";
    private static final String SUBTOPIC = SUBTOPICS + "/{subtopicId}";

    private final DocumentService documents;
    private final AuthService auth;
    private final JsonCodec json;

    record Credentials(String username, String password) {
    }

    record RegisteredUser(String username, Instant createdAt) {
    }

    @Inject
    public LabReportApi(DocumentService documents, AuthService auth, JsonCodec json) {
        this.documents = documents;
        this.auth = auth;
        this.json = json;
    }

    public ApiRouter register(ApiRouter router) {
        router.publicRoute(GET, "/api/health", req -> ApiResponse.ok(Map.of("status", "healthy")));
        router.publicRoute(POST, "/api/auth/register", this::registerUser);
        router.publicRoute(POST, "/api/auth/login", this::login);

        router.securedRoute(GET, REPORTS, req -> ApiResponse.ok(documents.listReports(req.actor())));
        router.securedRoute(POST, REPORTS, req -> ApiResponse.created(
                documents.createReport(json.read(req.body(), ReportFields.class), req.actor())));
        router.securedRoute(GET, REPORT, req -> ApiResponse.ok(documents.getReport(req.param("reportId"))));
        router.securedRoute(PUT, REPORT, req -> ApiResponse.ok(
                documents.updateReport(req.param("reportId"), json.read(req.body(), ReportFields.class))));
        router.securedRoute(DELETE, REPORT, req -> {
            documents.deleteReport(req.param("reportId"));
            return ApiResponse.message("Lab report and all associated data deleted successfully");
        });

        router.securedRoute(POST, QUESTIONS, req -> ApiResponse.created(
                documents.addQuestion(req.param("reportId"), json.read(req.body(), QuestionFields.class))));
        router.securedRoute(PUT, QUESTION, req -> ApiResponse.ok(
                documents.updateQuestion(req.param("reportId"), req.param("questionId"),
                        json.read(req.body(), QuestionFields.class))));
        router.securedRoute(DELETE, QUESTION, req -> {
            documents.deleteQuestion(req.param("reportId"), req.param("questionId"));
            return ApiResponse.message("Question deleted successfully");
        });

        router.securedRoute(POST, SUBTOPICS, req -> ApiResponse.created(
                documents.addSubtopic(req.param("reportId"), req.param("questionId"),
                        json.read(req.body(), SubtopicFields.class))));
        router.securedRoute(PUT, SUBTOPIC, req -> ApiResponse.ok(
                documents.updateSubtopic(req.param("reportId"), req.param("questionId"),
                        req.param("subtopicId"), json.read(req.body(), SubtopicFields.class))));
        router.securedRoute(DELETE, SUBTOPIC, req -> {
            documents.deleteSubtopic(req.param("reportId"), req.param("questionId"), req.param("subtopicId"));
            return ApiResponse.message("Subtopic deleted successfully");
        });
        return router;
    }

    private ApiResponse registerUser(ApiRequest request) {
        Credentials credentials = json.read(request.body(), Credentials.class);
        User user = auth.register(credentials.username(), credentials.password());
        return ApiResponse.created(new RegisteredUser(user.username(), user.createdAt()));
    }

    private ApiResponse login(ApiRequest request) {
        Credentials credentials = json.read(request.body(), Credentials.class);
        return ApiResponse.ok(auth.login(credentials.username(), credentials.password()));
    }
}
