package com.chainvote.chainvote_api.global.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class ApiPerfLoggingFilter extends OncePerRequestFilter {

	private static final Logger LOG = LoggerFactory.getLogger("api.perf");

	private final PerfLogProperties perfLogProperties;
	private final ObjectMapper objectMapper;

	public ApiPerfLoggingFilter(
		PerfLogProperties perfLogProperties,
		ObjectMapper objectMapper
	) {
		this.perfLogProperties = perfLogProperties;
		this.objectMapper = objectMapper;
	}

	@Override
	protected boolean shouldNotFilter(HttpServletRequest request) {
		if (!perfLogProperties.isEnabled()) {
			return true;
		}
		String path = request.getRequestURI();
		List<String> excluded = perfLogProperties.getExcludePathPrefixes();
		if (excluded == null || excluded.isEmpty()) {
			return false;
		}
		return excluded.stream()
			.anyMatch(prefix -> prefix != null && !prefix.isBlank() && path.startsWith(prefix));
	}

	@Override
	protected void doFilterInternal(
		HttpServletRequest request,
		HttpServletResponse response,
		FilterChain filterChain
	) throws ServletException, IOException {
		long startNs = System.nanoTime();
		RequestMetricsContext.start();
		Throwable throwable = null;
		try {
			filterChain.doFilter(request, response);
		} catch (Throwable ex) {
			throwable = ex;
			throw ex;
		} finally {
			long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
			RequestMetricsContext.Metrics metrics = RequestMetricsContext.snapshot();
			RequestMetricsContext.clear();

			int status = resolveStatus(response, throwable);
			PerfFlags flags = new PerfFlags(
				elapsedMs >= perfLogProperties.getSlowRequestMs(),
				metrics.queryTimeMs() >= perfLogProperties.getSlowQueryMs(),
				metrics.ledgerTimeMs() >= perfLogProperties.getSlowLedgerMs(),
				status >= HttpStatus.INTERNAL_SERVER_ERROR.value()
			);

			if (flags.any()) {
				logAsJson(request, status, elapsedMs, metrics, flags);
			}
		}
	}

	private int resolveStatus(HttpServletResponse response, Throwable throwable) {
		if (throwable != null && response.getStatus() < HttpStatus.BAD_REQUEST.value()) {
			return HttpStatus.INTERNAL_SERVER_ERROR.value();
		}
		return response.getStatus();
	}

	private void logAsJson(
		HttpServletRequest request,
		int status,
		long elapsedMs,
		RequestMetricsContext.Metrics metrics,
		PerfFlags flags
	) {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("type", "api_perf");
		fields.put("method", request.getMethod());
		fields.put("path", request.getRequestURI());
		fields.put("status", status);
		fields.put("elapsedMs", elapsedMs);
		fields.put("queryCount", metrics.queryCount());
		fields.put("queryTimeMs", metrics.queryTimeMs());
		fields.put("ledgerCallCount", metrics.ledgerCallCount());
		fields.put("ledgerTimeMs", metrics.ledgerTimeMs());
		fields.put("slowRequest", flags.slowRequest());
		fields.put("slowQuery", flags.slowQuery());
		fields.put("slowLedger", flags.slowLedger());
		fields.put("serverError", flags.serverError());
		fields.put("clientIp", resolveClientIp(request));

		String traceId = MDC.get("traceId");
		if (traceId != null && !traceId.isBlank()) {
			fields.put("traceId", traceId);
		}

		String requestId = request.getHeader("X-Request-Id");
		if (requestId != null && !requestId.isBlank()) {
			fields.put("requestId", requestId);
		}

		try {
			LOG.info(objectMapper.writeValueAsString(fields));
		} catch (JsonProcessingException ex) {
			LOG.info(
				"type=api_perf method={} path={} status={} elapsedMs={} queryTimeMs={} ledgerTimeMs={}",
				request.getMethod(),
				request.getRequestURI(),
				status,
				elapsedMs,
				metrics.queryTimeMs(),
				metrics.ledgerTimeMs()
			);
		}
	}

	public static String resolveClientIp(HttpServletRequest request) {
		String xForwardedFor = request.getHeader("X-Forwarded-For");
		if (xForwardedFor == null || xForwardedFor.isBlank()) {
			return request.getRemoteAddr();
		}
		String[] ips = xForwardedFor.split(",");
		return ips.length == 0 ? request.getRemoteAddr() : ips[0].trim();
	}

	private record PerfFlags(boolean slowRequest, boolean slowQuery, boolean slowLedger, boolean serverError) {
		boolean any() {
			return slowRequest || slowQuery || slowLedger || serverError;
		}
	}
}
