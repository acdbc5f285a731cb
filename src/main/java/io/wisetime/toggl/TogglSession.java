/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl;

import static io.wisetime.toggl.ResourcePaths.userResource;
import static io.wisetime.toggl.ResourcePaths.workspaceResource;
import static io.wisetime.toggl.ResourceType.CLIENTS;
import static io.wisetime.toggl.ResourceType.PROJECTS;
import static io.wisetime.toggl.ResourceType.TAGS;
import static io.wisetime.toggl.ResourceType.TIME_ENTRIES;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.wisetime.toggl.model.Account;
import io.wisetime.toggl.model.Client;
import io.wisetime.toggl.model.DetailedReport;
import io.wisetime.toggl.model.Project;
import io.wisetime.toggl.model.SummaryReport;
import io.wisetime.toggl.model.Tag;
import io.wisetime.toggl.model.TagAction;
import io.wisetime.toggl.model.TimeEntry;
import io.wisetime.toggl.model.TimeEntryReopenRequest;
import io.wisetime.toggl.model.TimeEntryRequest;
import io.wisetime.toggl.util.TogglDecodeException;
import io.wisetime.toggl.util.TogglException;
import io.wisetime.toggl.util.TogglHttpException;
import io.wisetime.toggl.util.TogglPartialFailureException;
import io.wisetime.toggl.util.TogglTransportException;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.http.Body;
import retrofit2.http.DELETE;
import retrofit2.http.GET;
import retrofit2.http.PATCH;
import retrofit2.http.POST;
import retrofit2.http.PUT;
import retrofit2.http.Query;
import retrofit2.http.QueryMap;
import retrofit2.http.Url;

/**
 * An authenticated connection to the Toggl API. One method per API capability.
 *
 * <p>A session never changes after creation and can be shared between threads. Sessions are created by
 * {@link TogglSessionFactory}, either from an API token or through a login exchange.
 *
 * <p>Failures are reported as {@link TogglException} subclasses; nothing is retried.
 *
 * @author pascal
 */
public class TogglSession {

  private static final Logger log = LoggerFactory.getLogger(TogglSession.class);

  private final TogglCredentials credentials;
  private final TogglConfig config;
  private final DiagnosticLog diagnosticLog;
  private final TogglApi togglApi;
  private final TogglReportsApi reportsApi;

  TogglSession(TogglCredentials credentials, TogglConfig config, DiagnosticLog diagnosticLog,
               TogglApi togglApi, TogglReportsApi reportsApi) {
    this.credentials = credentials;
    this.config = config;
    this.diagnosticLog = diagnosticLog;
    this.togglApi = togglApi;
    this.reportsApi = reportsApi;
  }

  public TogglCredentials getCredentials() {
    return credentials;
  }

  /**
   * Returns the user's account, including workspaces, clients, projects, tasks, tags and time entries.
   */
  public Account getAccount() {
    return fetchAccount(true);
  }

  Account fetchAccount(boolean withRelatedData) {
    diagnosticLog.log("Fetching account (related data: {})", withRelatedData);
    return decoded("/me", executeCall(togglApi.getMe(withRelatedData ? Boolean.TRUE : null)));
  }

  // time entries ///////////////////////////////////////////////////////

  /**
   * Starts a new running time entry.
   */
  public TimeEntry startTimeEntry(String description, long workspaceId) {
    return startTimeEntry(newStartRequest(description, workspaceId));
  }

  /**
   * Starts a new running time entry for a project. The billable flag is only honoured by paid Toggl plans.
   */
  public TimeEntry startTimeEntryForProject(String description, long workspaceId, long projectId, Boolean billable) {
    TimeEntryRequest request = newStartRequest(description, workspaceId).setProjectId(projectId);
    if (billable != null) {
      request.setBillable(billable);
    }
    return startTimeEntry(request);
  }

  /**
   * Creates a time entry from a fully prepared request. The created-with marker is filled in when missing; the
   * given request itself is left unchanged.
   */
  public TimeEntry startTimeEntry(TimeEntryRequest request) {
    TimeEntryRequest toSend = request.copy();
    if (toSend.getCreatedWith() == null) {
      toSend.setCreatedWith(config.getAppName());
    }
    String path = workspaceResource(TIME_ENTRIES, toSend.getWorkspaceId());
    return decoded(path, executeCall(togglApi.createTimeEntry(relative(path), toSend)));
  }

  /**
   * Returns the running time entry, if there is one.
   */
  public Optional<TimeEntry> getCurrentTimeEntry() {
    String path = userResource(TIME_ENTRIES) + "/current";
    return executeOptionalCall(togglApi.getTimeEntry(relative(path)));
  }

  /**
   * Returns the user's time entries started between the two instants.
   */
  public List<TimeEntry> getTimeEntries(OffsetDateTime startDate, OffsetDateTime endDate) {
    String path = userResource(TIME_ENTRIES);
    return decoded(path, executeCall(togglApi.getTimeEntries(relative(path), rfc3339(startDate), rfc3339(endDate))));
  }

  public TimeEntry updateTimeEntry(TimeEntry timeEntry) {
    diagnosticLog.log("Updating time entry {}", timeEntry);
    String path = workspaceResource(TIME_ENTRIES, timeEntry.getWorkspaceId(), timeEntry.getId());
    return decoded(path, executeCall(togglApi.updateTimeEntry(relative(path), timeEntry)));
  }

  /**
   * Continues a time entry.
   *
   * <p>A duration-only continuation of an entry started today re-opens that very entry. Any other continuation
   * starts a new entry with the description, project, task, tags and billable flag of the given one.
   */
  public TimeEntry continueTimeEntry(TimeEntry timeEntry, boolean durationOnly) {
    diagnosticLog.log("Continuing time entry {}", timeEntry);
    if (durationOnly && startedToday(timeEntry)) {
      String path = workspaceResource(TIME_ENTRIES, timeEntry.getWorkspaceId(), timeEntry.getId());
      TimeEntryReopenRequest request = TimeEntryReopenRequest.of(timeEntry);
      return decoded(path, executeCall(togglApi.reopenTimeEntry(relative(path), request)));
    }
    return startTimeEntry(newStartRequest(timeEntry.getDescription(), timeEntry.getWorkspaceId())
        .withMetadataFrom(timeEntry));
  }

  /**
   * Starts a copy of the given entry, keeping its start time, then deletes the given entry.
   *
   * @throws TogglPartialFailureException if the copy was created but the original could not be deleted
   */
  public TimeEntry unstopTimeEntry(TimeEntry timeEntry) {
    diagnosticLog.log("Unstopping time entry {}", timeEntry);
    TimeEntryRequest request = newStartRequest(timeEntry.getDescription(), timeEntry.getWorkspaceId())
        .withMetadataFrom(timeEntry);
    if (timeEntry.getStart() != null) {
      request.setStart(timeEntry.getStart());
    }

    TimeEntry newEntry = startTimeEntry(request);
    try {
      deleteTimeEntry(timeEntry);
    } catch (TogglException e) {
      log.warn("Time entry {} was restarted as {} but could not be deleted: {}",
          timeEntry.getId(), newEntry.getId(), e.getMessage());
      throw new TogglPartialFailureException("old entry not deleted", newEntry, e);
    }
    return newEntry;
  }

  public TimeEntry stopTimeEntry(TimeEntry timeEntry) {
    diagnosticLog.log("Stopping time entry {}", timeEntry);
    String path = workspaceResource(TIME_ENTRIES, timeEntry.getWorkspaceId(), timeEntry.getId()) + "/stop";
    return decoded(path, executeCall(togglApi.stopTimeEntry(relative(path))));
  }

  /**
   * Adds a tag to, or removes it from, a time entry on the server.
   */
  public TimeEntry updateTimeEntryTag(long workspaceId, long timeEntryId, String tag, TagAction action) {
    diagnosticLog.log("Applying tag action {} with tag {} to time entry {}", action, tag, timeEntryId);
    Map<String, Object> tagUpdate = ImmutableMap.of(
        "tags", ImmutableList.of(tag),
        "tag_action", action.getValue());
    String path = workspaceResource(TIME_ENTRIES, workspaceId, timeEntryId);
    return decoded(path, executeCall(togglApi.updateTimeEntryTags(relative(path), tagUpdate)));
  }

  public void deleteTimeEntry(TimeEntry timeEntry) {
    diagnosticLog.log("Deleting time entry {}", timeEntry);
    delete(workspaceResource(TIME_ENTRIES, timeEntry.getWorkspaceId(), timeEntry.getId()));
  }

  // projects ///////////////////////////////////////////////////////////

  public List<Project> getProjects(long workspaceId) {
    diagnosticLog.log("Getting projects for workspace {}", workspaceId);
    String path = workspaceResource(PROJECTS, workspaceId);
    return decoded(path, executeCall(togglApi.getProjects(relative(path))));
  }

  public Project getProject(long workspaceId, long projectId) {
    diagnosticLog.log("Getting project with id {}", projectId);
    String path = workspaceResource(PROJECTS, workspaceId, projectId);
    return decoded(path, executeCall(togglApi.getProject(relative(path))));
  }

  /**
   * Creates a new, active project.
   */
  public Project createProject(String name, long workspaceId) {
    diagnosticLog.log("Creating project {}", name);
    Map<String, Object> project = ImmutableMap.of(
        "name", name,
        "wid", workspaceId,
        "active", true);
    String path = workspaceResource(PROJECTS, workspaceId);
    return decoded(path, executeCall(togglApi.createProject(relative(path), project)));
  }

  public Project updateProject(Project project) {
    diagnosticLog.log("Updating project {}", project.getId());
    String path = workspaceResource(PROJECTS, project.getWorkspaceId(), project.getId());
    return decoded(path, executeCall(togglApi.updateProject(relative(path), project)));
  }

  public void deleteProject(Project project) {
    diagnosticLog.log("Deleting project {}", project.getId());
    delete(workspaceResource(PROJECTS, project.getWorkspaceId(), project.getId()));
  }

  // tags ///////////////////////////////////////////////////////////////

  public List<Tag> getTags(long workspaceId) {
    diagnosticLog.log("Getting tags for workspace {}", workspaceId);
    String path = workspaceResource(TAGS, workspaceId);
    return decoded(path, executeCall(togglApi.getTags(relative(path))));
  }

  public Tag createTag(String name, long workspaceId) {
    diagnosticLog.log("Creating tag {}", name);
    Map<String, Object> tag = ImmutableMap.of(
        "name", name,
        "wid", workspaceId);
    String path = workspaceResource(TAGS, workspaceId);
    return decoded(path, executeCall(togglApi.createTag(relative(path), tag)));
  }

  public Tag updateTag(Tag tag) {
    diagnosticLog.log("Updating tag {}", tag.getId());
    String path = workspaceResource(TAGS, tag.getWorkspaceId(), tag.getId());
    return decoded(path, executeCall(togglApi.updateTag(relative(path), tag)));
  }

  public void deleteTag(Tag tag) {
    diagnosticLog.log("Deleting tag {}", tag.getId());
    delete(workspaceResource(TAGS, tag.getWorkspaceId(), tag.getId()));
  }

  // clients ////////////////////////////////////////////////////////////

  public List<Client> getClients(long workspaceId) {
    diagnosticLog.log("Retrieving clients for workspace {}", workspaceId);
    String path = workspaceResource(CLIENTS, workspaceId);
    return decoded(path, executeCall(togglApi.getClients(relative(path))));
  }

  public Client getClient(long workspaceId, long clientId) {
    diagnosticLog.log("Retrieving client with id {}", clientId);
    String path = workspaceResource(CLIENTS, workspaceId, clientId);
    return decoded(path, executeCall(togglApi.getClient(relative(path))));
  }

  public Client createClient(String name, long workspaceId) {
    diagnosticLog.log("Creating client {}", name);
    Map<String, Object> client = ImmutableMap.of(
        "name", name,
        "wid", workspaceId);
    String path = workspaceResource(CLIENTS, workspaceId);
    return decoded(path, executeCall(togglApi.createClient(relative(path), client)));
  }

  public Client updateClient(Client client) {
    diagnosticLog.log("Updating client {}", client.getId());
    String path = workspaceResource(CLIENTS, client.getWorkspaceId(), client.getId());
    return decoded(path, executeCall(togglApi.updateClient(relative(path), client)));
  }

  public void deleteClient(Client client) {
    diagnosticLog.log("Deleting client {}", client.getId());
    delete(workspaceResource(CLIENTS, client.getWorkspaceId(), client.getId()));
  }

  // reports ////////////////////////////////////////////////////////////

  /**
   * Retrieves a summary report for the workspace, grouped by project.
   */
  public SummaryReport getSummaryReport(long workspaceId, LocalDate since, LocalDate until) {
    Map<String, String> params = ImmutableMap.<String, String>builder()
        .putAll(reportParams(workspaceId, since, until))
        .put("grouping", "projects")
        .build();
    return decoded("/summary", executeCall(reportsApi.getSummaryReport(params)));
  }

  /**
   * Retrieves one page of a detailed report for the workspace. Pages start at 1.
   */
  public DetailedReport getDetailedReport(long workspaceId, LocalDate since, LocalDate until, int page) {
    Map<String, String> params = ImmutableMap.<String, String>builder()
        .putAll(reportParams(workspaceId, since, until))
        .put("page", Integer.toString(page))
        .build();
    return decoded("/details", executeCall(reportsApi.getDetailedReport(params)));
  }

  // support ////////////////////////////////////////////////////////////

  private Map<String, String> reportParams(long workspaceId, LocalDate since, LocalDate until) {
    return ImmutableMap.of(
        "user_agent", config.getUserAgent(),
        "since", since.format(DateTimeFormatter.ISO_LOCAL_DATE),
        "until", until.format(DateTimeFormatter.ISO_LOCAL_DATE),
        "rounding", "on",
        "workspace_id", Long.toString(workspaceId));
  }

  private TimeEntryRequest newStartRequest(String description, long workspaceId) {
    return new TimeEntryRequest()
        .setDuration(-1)
        .setDescription(description)
        .setStart(OffsetDateTime.now(config.getClock()))
        .setWorkspaceId(workspaceId);
  }

  private boolean startedToday(TimeEntry timeEntry) {
    if (timeEntry.getStart() == null) {
      return false;
    }
    Clock clock = config.getClock();
    return timeEntry.getStart().atZoneSameInstant(clock.getZone()).toLocalDate().equals(LocalDate.now(clock));
  }

  private void delete(String path) {
    execute(togglApi.delete(relative(path)));
  }

  private <T> T decoded(String path, T value) {
    diagnosticLog.log("Decoded response of {} into {}", path, value);
    return value;
  }

  private static String rfc3339(OffsetDateTime dateTime) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime.truncatedTo(ChronoUnit.SECONDS));
  }

  // Retrofit resolves a leading slash against the host root, which would drop the API version
  @VisibleForTesting
  static String relative(String path) {
    return path.startsWith("/") ? path.substring(1) : path;
  }

  <T> T executeCall(Call<T> call) {
    Response<T> response = execute(call);
    if (response.body() != null) {
      return response.body();
    }
    if (!response.isSuccessful()) {
      // 3xx passes the status check, but Retrofit only decodes bodies of 2xx responses
      throw httpException(response);
    }
    throw new TogglDecodeException("Toggl returned an empty response for " + call.request());
  }

  <T> Optional<T> executeOptionalCall(Call<T> call) {
    return Optional.ofNullable(execute(call).body());
  }

  <T> Response<T> execute(Call<T> call) {
    final Response<T> response;
    try {
      response = call.execute();
    } catch (IOException e) {
      throw new TogglTransportException("Unable to reach Toggl: " + e.getMessage(), e);
    }
    if (response.code() < 200 || response.code() >= 400) {
      log.warn("Request {} failed with {} {}", call.request(), response.code(), response.message());
      throw httpException(response);
    }
    return response;
  }

  private static TogglHttpException httpException(Response<?> response) {
    String statusLine = response.code() + " " + response.message();
    return new TogglHttpException(response.code(), statusLine, readErrorBody(response));
  }

  private static String readErrorBody(Response<?> response) {
    // prevent potential null pointer exception
    try (ResponseBody errorBody = response.errorBody()) {
      return errorBody != null ? errorBody.string() : "";
    } catch (IOException e) {
      throw new TogglTransportException("Unable to read Toggl error response: " + e.getMessage(), e);
    }
  }

  interface TogglApi {

    @GET("me")
    Call<Account> getMe(@Query("with_related_data") Boolean withRelatedData);

    @GET
    Call<TimeEntry> getTimeEntry(@Url String path);

    @GET
    Call<List<TimeEntry>> getTimeEntries(@Url String path, @Query("start_date") String startDate,
                                         @Query("end_date") String endDate);

    @POST
    Call<TimeEntry> createTimeEntry(@Url String path, @Body TimeEntryRequest request);

    @PUT
    Call<TimeEntry> updateTimeEntry(@Url String path, @Body TimeEntry timeEntry);

    @PUT
    Call<TimeEntry> reopenTimeEntry(@Url String path, @Body TimeEntryReopenRequest request);

    @PUT
    Call<TimeEntry> updateTimeEntryTags(@Url String path, @Body Map<String, Object> tagUpdate);

    @PATCH
    Call<TimeEntry> stopTimeEntry(@Url String path);

    @GET
    Call<List<Project>> getProjects(@Url String path);

    @GET
    Call<Project> getProject(@Url String path);

    @POST
    Call<Project> createProject(@Url String path, @Body Map<String, Object> project);

    @PUT
    Call<Project> updateProject(@Url String path, @Body Project project);

    @GET
    Call<List<Tag>> getTags(@Url String path);

    @POST
    Call<Tag> createTag(@Url String path, @Body Map<String, Object> tag);

    @PUT
    Call<Tag> updateTag(@Url String path, @Body Tag tag);

    @GET
    Call<List<Client>> getClients(@Url String path);

    @GET
    Call<Client> getClient(@Url String path);

    @POST
    Call<Client> createClient(@Url String path, @Body Map<String, Object> client);

    @PUT
    Call<Client> updateClient(@Url String path, @Body Client client);

    @DELETE
    Call<Void> delete(@Url String path);
  }

  interface TogglReportsApi {

    @GET("summary")
    Call<SummaryReport> getSummaryReport(@QueryMap Map<String, String> params);

    @GET("details")
    Call<DetailedReport> getDetailedReport(@QueryMap Map<String, String> params);
  }
}
