package hk.edu.hulab.portal.backend.analytics;

import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.ExtensionKey;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.StatementResult;
import hk.edu.hulab.portal.backend.model.Vocabulary;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Metric formulas over a slice of statements. Everything here is a pure function of its arguments.
 */
public final class MetricsCalculator {

    private static final List<String> ATTEMPT_VERBS = List.of("attempted", "started");
    private static final List<String> COMPLETION_VERBS = List.of("completed", "finished");
    private static final List<String> COLLABORATION_VERBS = List.of("collaborated", "shared", "commented");

    private static final String PROJECT_SEGMENT = "/project/";

    private MetricsCalculator() {
    }

    /**
     * Completions per attempt as a percentage, capped at 100; 0 when nothing was attempted.
     */
    public static double completionRate(List<Statement> statements) {
        long attempts = statements.stream().filter(s -> verbMatches(s, ATTEMPT_VERBS)).count();
        if (attempts == 0) {
            return 0;
        }
        long completions = statements.stream().filter(s -> verbMatches(s, COMPLETION_VERBS)).count();
        return Math.min(100.0, completions * 100.0 / attempts);
    }

    /**
     * Weighted 0-100 score: volume 40%, verb diversity 30%, day coverage 20%, completion 10%.
     */
    public static int engagementScore(List<Statement> statements, Instant now, ZoneId zone) {
        if (statements.isEmpty()) {
            return 0;
        }
        double volume = Math.min(statements.size() / 100.0, 1.0);
        long distinctVerbs = statements.stream().map(MetricsCalculator::verbId).filter(Objects::nonNull).distinct().count();
        double diversity = Math.min(distinctVerbs / 10.0, 1.0);
        double consistency = consistency(statements, now, zone);
        double completion = completionRate(statements) / 100.0;
        return (int) Math.round((volume * 0.4 + diversity * 0.3 + consistency * 0.2 + completion * 0.1) * 100);
    }

    /**
     * Active days divided by days elapsed since the oldest statement (inclusive of today), capped at 1.
     */
    public static double consistency(List<Statement> statements, Instant now, ZoneId zone) {
        Set<LocalDate> activeDays = statements.stream()
                .map(Statement::getTimestamp)
                .filter(Objects::nonNull)
                .map(ts -> LocalDate.ofInstant(ts, zone))
                .collect(Collectors.toSet());
        if (activeDays.isEmpty()) {
            return 0;
        }
        LocalDate oldest = activeDays.stream().min(Comparator.naturalOrder()).orElseThrow();
        long elapsedDays = ChronoUnit.DAYS.between(oldest, LocalDate.ofInstant(now, zone)) + 1;
        return Math.min((double) activeDays.size() / Math.max(elapsedDays, 1), 1.0);
    }

    public static CollaborationIndex collaborationIndex(List<Statement> statements) {
        List<Statement> collaboration = statements.stream()
                .filter(s -> verbMatches(s, COLLABORATION_VERBS))
                .toList();
        Set<String> partners = new LinkedHashSet<>();
        collaboration.forEach(s -> team(s).forEach(member -> partners.add(member.getMbox())));
        double score = statements.isEmpty() ? 0 : Math.min(100.0, collaboration.size() * 100.0 / statements.size());
        return new CollaborationIndex(score, collaboration.size(), partners.size());
    }

    public static UserCollaborationMetrics userCollaboration(String email, List<Statement> statements) {
        String self = Actor.ofEmail(email).getMbox();
        Set<String> partners = new LinkedHashSet<>();
        statements.stream()
                .filter(s -> verbMatches(s, COLLABORATION_VERBS))
                .forEach(s -> team(s).stream()
                        .map(Actor::getMbox)
                        .filter(mbox -> mbox != null && !mbox.equals(self))
                        .forEach(partners::add));
        return new UserCollaborationMetrics(
                countVerb(statements, "collaborated"),
                countVerb(statements, "shared"),
                countVerb(statements, "commented"),
                partners.size());
    }

    /**
     * Verb display text to count, most frequent first.
     */
    public static Map<String, Long> activityBreakdown(List<Statement> statements) {
        Map<String, Long> counts = statements.stream()
                .collect(Collectors.groupingBy(Statement::verbDisplay, Collectors.counting()));
        return sortedByCount(counts);
    }

    public static List<VerbCount> topActivities(List<Statement> statements, int limit) {
        return activityBreakdown(statements).entrySet().stream()
                .limit(limit)
                .map(e -> new VerbCount(e.getKey(), e.getValue()))
                .toList();
    }

    public static Map<Integer, Long> timeDistribution(List<Statement> statements, ZoneId zone) {
        Map<Integer, Long> hours = new TreeMap<>();
        statements.stream()
                .map(Statement::getTimestamp)
                .filter(Objects::nonNull)
                .forEach(ts -> hours.merge(ts.atZone(zone).getHour(), 1L, Long::sum));
        return hours;
    }

    public static List<UserRanking> userRankings(List<Statement> statements, int limit) {
        Map<String, Long> perUser = sortedByCount(statements.stream()
                .map(Statement::actorEmail)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting())));
        List<UserRanking> rankings = new ArrayList<>();
        for (Map.Entry<String, Long> entry : perUser.entrySet()) {
            if (rankings.size() >= limit) {
                break;
            }
            rankings.add(new UserRanking(rankings.size() + 1, entry.getKey(), entry.getValue()));
        }
        return rankings;
    }

    public static List<RecentActivity> recentActivities(List<Statement> statements, int limit) {
        return statements.stream()
                .filter(s -> s.getTimestamp() != null)
                .sorted(Comparator.comparing(Statement::getTimestamp).reversed())
                .limit(limit)
                .map(s -> new RecentActivity(
                        s.getActor() != null && s.getActor().getName() != null ? s.getActor().getName() : s.actorEmail(),
                        s.verbDisplay(),
                        s.getObject() != null ? s.getObject().displayName() : null,
                        s.getTimestamp()))
                .toList();
    }

    public static long uniqueUsers(List<Statement> statements) {
        return statements.stream().map(Statement::actorEmail).filter(Objects::nonNull).distinct().count();
    }

    /**
     * Distinct actor e-mails, sorted.
     */
    public static List<String> activeUsers(List<Statement> statements) {
        return statements.stream().map(Statement::actorEmail).filter(Objects::nonNull).distinct().sorted().toList();
    }

    public static List<Statement> failures(List<Statement> statements) {
        return statements.stream()
                .filter(s -> s.getResult() != null && Boolean.FALSE.equals(s.getResult().getSuccess()))
                .toList();
    }

    /**
     * {@code count / total}, 0 when total is 0.
     */
    public static double ratio(long count, long total) {
        return total > 0 ? (double) count / total : 0.0;
    }

    /**
     * Distinct project addresses referenced either as the statement object or as its first context parent.
     */
    public static long activeProjects(List<Statement> statements) {
        Set<String> projects = new LinkedHashSet<>();
        for (Statement statement : statements) {
            if (statement.getObject() != null && isProjectAddress(statement.getObject().getId())) {
                projects.add(statement.getObject().getId());
            }
            Activity parent = firstParent(statement);
            if (parent != null && isProjectAddress(parent.getId())) {
                projects.add(parent.getId());
            }
        }
        return projects.size();
    }

    public static AssessmentPerformance assessmentPerformance(List<Statement> statements) {
        List<Statement> assessments = statements.stream()
                .filter(s -> verbMatches(s, List.of("assessed"))
                        || Vocabulary.TYPE_ASSESSMENT.equals(s.getObject() != null ? s.getObject().type() : null))
                .toList();
        long completed = statements.stream()
                .filter(s -> verbMatches(s, COMPLETION_VERBS)
                        || (s.getResult() != null && Boolean.TRUE.equals(s.getResult().getCompletion())))
                .count();
        long passed = assessments.stream()
                .filter(s -> s.getResult() != null && Boolean.TRUE.equals(s.getResult().getSuccess()))
                .count();
        return new AssessmentPerformance(assessments.size(), completed, passed, averageScaledScore(assessments));
    }

    public static AiInteractionMetrics aiInteraction(List<Statement> statements) {
        List<Statement> queries = statements.stream().filter(s -> verbMatches(s, List.of("queried"))).toList();
        long tokens = queries.stream()
                .mapToLong(s -> {
                    long fromContext = s.contextExtensions().getLong(ExtensionKey.AI_TOKENS, 0);
                    if (fromContext > 0 || s.getResult() == null || s.getResult().getExtensions() == null) {
                        return fromContext;
                    }
                    return s.getResult().getExtensions().getLong(ExtensionKey.AI_TOKENS, 0);
                })
                .sum();
        double perQuery = queries.isEmpty() ? 0 : (double) tokens / queries.size();
        return new AiInteractionMetrics(queries.size(), tokens, perQuery, averageScaledScore(queries));
    }

    public static ActivityPatterns activityPatterns(List<Statement> statements, ZoneId zone) {
        Map<Integer, Long> byHour = timeDistribution(statements, zone);
        Map<String, Long> byWeekday = new LinkedHashMap<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            byWeekday.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), 0L);
        }
        statements.stream()
                .map(Statement::getTimestamp)
                .filter(Objects::nonNull)
                .forEach(ts -> byWeekday.merge(ts.atZone(zone).getDayOfWeek()
                        .getDisplayName(TextStyle.FULL, Locale.ENGLISH), 1L, Long::sum));
        Integer mostActiveHour = byHour.entrySet().stream()
                .max(Map.Entry.<Integer, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);
        return new ActivityPatterns(byHour, byWeekday, mostActiveHour);
    }

    /**
     * Hours with the most statements, busiest first, ties broken by earlier hour.
     */
    public static List<Integer> peakHours(List<Statement> statements, ZoneId zone, int limit) {
        return timeDistribution(statements, zone).entrySet().stream()
                .sorted(Map.Entry.<Integer, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Statements per ISO date, oldest first.
     */
    public static Map<String, Long> dailyTimeline(List<Statement> statements, ZoneId zone) {
        Map<String, Long> days = new TreeMap<>();
        statements.stream()
                .map(Statement::getTimestamp)
                .filter(Objects::nonNull)
                .forEach(ts -> days.merge(LocalDate.ofInstant(ts, zone).toString(), 1L, Long::sum));
        return days;
    }

    public static Map<String, Long> phaseBreakdown(List<Statement> statements) {
        Map<String, Long> phases = new TreeMap<>();
        statements.stream()
                .map(s -> s.contextExtensions().getString(ExtensionKey.RIDE_I_PHASE))
                .filter(Objects::nonNull)
                .forEach(phase -> phases.merge(phase, 1L, Long::sum));
        return phases;
    }

    public static List<PhaseTransition> phaseTransitions(List<Statement> statements) {
        return statements.stream()
                .filter(s -> verbMatches(s, List.of("advanced")))
                .filter(s -> s.getTimestamp() != null)
                .sorted(Comparator.comparing(Statement::getTimestamp))
                .map(s -> new PhaseTransition(
                        s.contextExtensions().getString(ExtensionKey.PREVIOUS_PHASE),
                        s.contextExtensions().getString(ExtensionKey.RIDE_I_PHASE),
                        s.actorEmail(),
                        s.getTimestamp()))
                .toList();
    }

    /**
     * Per-actor activity, most active first.
     */
    public static List<ContributorMetric> contributorMetrics(List<Statement> statements) {
        Map<String, List<Statement>> byActor = statements.stream()
                .filter(s -> s.actorEmail() != null)
                .collect(Collectors.groupingBy(Statement::actorEmail, LinkedHashMap::new, Collectors.toList()));
        return byActor.entrySet().stream()
                .map(e -> {
                    List<Instant> times = e.getValue().stream()
                            .map(Statement::getTimestamp)
                            .filter(Objects::nonNull)
                            .sorted()
                            .toList();
                    return new ContributorMetric(
                            e.getKey(),
                            e.getValue().size(),
                            activityBreakdown(e.getValue()),
                            times.isEmpty() ? null : times.get(0),
                            times.isEmpty() ? null : times.get(times.size() - 1));
                })
                .sorted(Comparator.comparingLong(ContributorMetric::activities).reversed()
                        .thenComparing(ContributorMetric::user))
                .toList();
    }

    /**
     * Agents are nodes; every pair of agents appearing on the same statement (actor plus team) adds one to
     * the weight of their edge.
     */
    public static CollaborationNetwork collaborationNetwork(List<Statement> statements) {
        Map<String, Long> activity = new HashMap<>();
        Map<String, Long> edgeWeights = new HashMap<>();
        Map<String, Set<String>> neighbours = new HashMap<>();

        for (Statement statement : statements) {
            Set<String> participants = new LinkedHashSet<>();
            if (statement.actorEmail() != null) {
                participants.add(statement.actorEmail());
            }
            team(statement).stream().map(Actor::email).filter(Objects::nonNull).forEach(participants::add);
            participants.forEach(p -> activity.merge(p, 1L, Long::sum));

            List<String> ordered = participants.stream().sorted().toList();
            for (int i = 0; i < ordered.size(); i++) {
                for (int j = i + 1; j < ordered.size(); j++) {
                    String a = ordered.get(i);
                    String b = ordered.get(j);
                    edgeWeights.merge(a + "\n" + b, 1L, Long::sum);
                    neighbours.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
                    neighbours.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
                }
            }
        }

        int others = Math.max(activity.size() - 1, 1);
        List<NetworkNode> nodes = activity.entrySet().stream()
                .map(e -> {
                    int degree = neighbours.getOrDefault(e.getKey(), Set.of()).size();
                    return new NetworkNode(e.getKey(), e.getValue(), degree, activity.size() > 1
                            ? (double) degree / others
                            : 0);
                })
                .sorted(Comparator.comparingInt(NetworkNode::degree).reversed()
                        .thenComparing(NetworkNode::id))
                .toList();
        List<NetworkEdge> edges = edgeWeights.entrySet().stream()
                .map(e -> {
                    String[] pair = e.getKey().split("\n");
                    return new NetworkEdge(pair[0], pair[1], e.getValue());
                })
                .sorted(Comparator.comparingLong(NetworkEdge::weight).reversed()
                        .thenComparing(NetworkEdge::source)
                        .thenComparing(NetworkEdge::target))
                .toList();
        return new CollaborationNetwork(nodes, edges);
    }

    public static boolean isProjectAddress(String id) {
        return id != null && id.contains(PROJECT_SEGMENT);
    }

    private static Double averageScaledScore(List<Statement> statements) {
        OptionalDouble average = statements.stream()
                .map(Statement::getResult)
                .filter(Objects::nonNull)
                .map(StatementResult::scaledScore)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }

    private static long countVerb(List<Statement> statements, String fragment) {
        return statements.stream().filter(s -> verbMatches(s, List.of(fragment))).count();
    }

    private static boolean verbMatches(Statement statement, List<String> fragments) {
        return statement.getVerb() != null && fragments.stream().anyMatch(statement.getVerb()::idContains);
    }

    private static String verbId(Statement statement) {
        return statement.getVerb() != null ? statement.getVerb().getId() : null;
    }

    private static List<Actor> team(Statement statement) {
        if (statement.getContext() == null || statement.getContext().getTeam() == null) {
            return List.of();
        }
        return statement.getContext().getTeam();
    }

    private static Map<String, Long> sortedByCount(Map<String, Long> counts) {
        Map<String, Long> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private static Activity firstParent(Statement statement) {
        StatementContext context = statement.getContext();
        if (context == null || context.getContextActivities() == null) {
            return null;
        }
        List<Activity> parents = context.getContextActivities().getParent();
        return parents == null || parents.isEmpty() ? null : parents.get(0);
    }
}
