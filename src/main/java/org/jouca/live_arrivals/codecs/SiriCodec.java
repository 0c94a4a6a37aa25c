package org.jouca.live_arrivals.codecs;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.jouca.live_arrivals.model.AggregatedResponse;
import org.jouca.live_arrivals.model.Visit;
import org.jouca.live_arrivals.records.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Encodes stop-monitoring requests and decodes their responses.
 *
 * <p><b>Requests:</b> one SOAP envelope per group of stops, carrying a request timestamp and a
 * message identifier, and one {@code StopMonitoringRequest} per stop numbered from 0.
 *
 * <p><b>Responses:</b> two shapes are accepted.
 * <ul>
 *   <li>SOAP/XML: {@code S:Envelope/S:Body/ns7:GetStopMonitoringServiceResponse/Answer}. The SIRI
 *       prefix changes between protocol versions; it is discovered from the namespace
 *       declarations of the service response element, {@code ns3:} when none matches.</li>
 *   <li>JSON: {@code Siri/ServiceDelivery} with unprefixed field names.</li>
 * </ul>
 * Repeated fields come as a single value when only one is present, so every multi-valued field
 * goes through {@link #listify(JsonNode)} before it is iterated.
 *
 * <p>A response that lacks the envelope fields is a schema error: the raw payload is logged and a
 * {@link SchemaException} is thrown. A delivery whose status is not {@code true} adds its error
 * description to the response errors and no visits.
 *
 * @author Jouca
 * @since 1.0
 */
public class SiriCodec {
    private static final Logger logger = LoggerFactory.getLogger(SiriCodec.class);

    /** Namespace URI of SIRI elements. */
    static final String SIRI_NAMESPACE_URI = "http://www.siri.org.uk/siri";

    /** Prefix used when the response declares no SIRI namespace. */
    static final String DEFAULT_PREFIX = "ns3:";

    private static final DateTimeFormatter TRIP_DATE = DateTimeFormatter.ofPattern("ddMMyy");

    // local date-time, then an offset written +02:00, +0200, +02 or Z, or none at all
    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HH", "Z").optionalEnd()
        .toFormatter(Locale.ROOT);

    private static final String REQUEST_TEMPLATE = "<SOAP-ENV:Envelope"
        + " xmlns:SOAP-ENV=\"http://schemas.xmlsoap.org/soap/envelope/\""
        + " xmlns:SOAP-ENC=\"http://schemas.xmlsoap.org/soap/encoding/\""
        + " xmlns:acsb=\"http://www.ifopt.org.uk/acsb\""
        + " xmlns:datex2=\"http://datex2.eu/schema/1_0/1_0\""
        + " xmlns:ifopt=\"http://www.ifopt.org.uk/ifopt\""
        + " xmlns:siri=\"http://www.siri.org.uk/siri\""
        + " xmlns:siriWS=\"http://new.webservice.namespace\""
        + " xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\""
        + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\""
        + " xsi:schemaLocation=\"./siri\">"
        + "<SOAP-ENV:Header />"
        + "<SOAP-ENV:Body>"
        + "<siriWS:GetStopMonitoringService>"
        + "<Request xsi:type=\"siri:ServiceRequestStructure\">"
        + "<siri:RequestTimestamp>%1$s</siri:RequestTimestamp>"
        + "<siri:RequestorRef xsi:type=\"siri:ParticipantRefStructure\">%2$s</siri:RequestorRef>"
        + "<siri:MessageIdentifier xsi:type=\"siri:MessageQualifierStructure\">%2$s:%3$s</siri:MessageIdentifier>"
        + "%4$s"
        + "</Request>"
        + "</siriWS:GetStopMonitoringService>"
        + "</SOAP-ENV:Body>"
        + "</SOAP-ENV:Envelope>";

    private static final String REQUEST_BODY = "<siri:StopMonitoringRequest version=\"IL2.71\""
        + " xsi:type=\"siri:StopMonitoringRequestStructure\">"
        + "<siri:RequestTimestamp>%1$s</siri:RequestTimestamp>"
        + "<siri:MessageIdentifier xsi:type=\"siri:MessageQualifierStructure\">%2$d</siri:MessageIdentifier>"
        + "<siri:PreviewInterval>%3$s</siri:PreviewInterval>"
        + "<siri:MonitoringRef xsi:type=\"siri:MonitoringRefStructure\">%4$s</siri:MonitoringRef>"
        + "<siri:MaximumStopVisits>%5$d</siri:MaximumStopVisits>"
        + "</siri:StopMonitoringRequest>";

    private final SiriEnvelopeReader reader;
    private final String requestorRef;
    private final String previewInterval;
    private final Clock clock;

    /**
     * @param reader parses raw responses
     * @param requestorRef participant identifier sent with every request
     * @param previewInterval ISO-8601 duration of the look-ahead window, e.g. {@code PT30M}
     * @param clock source of request timestamps, in the zone they are written in
     */
    public SiriCodec(SiriEnvelopeReader reader, String requestorRef, String previewInterval, Clock clock) {
        this.reader = reader;
        this.requestorRef = requestorRef;
        this.previewInterval = previewInterval;
        this.clock = clock;
    }

    /**
     * Builds one batched request for {@code stopCodes}.
     *
     * @param stopCodes stop codes of one group
     * @param maxVisits maximum number of visits per stop
     * @return the SOAP request payload
     */
    public String encode(List<String> stopCodes, int maxVisits) {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        String timestamp = now.toString();
        String numericTimestamp = String.format(Locale.ROOT, "%.3f", clock.millis() / 1000.0);

        StringBuilder body = new StringBuilder();
        for (int i = 0; i < stopCodes.size(); i++) {
            body.append(String.format(REQUEST_BODY, timestamp, i, escape(previewInterval),
                escape(stopCodes.get(i)), maxVisits));
        }
        return String.format(REQUEST_TEMPLATE, timestamp, escape(requestorRef), numericTimestamp, body);
    }

    /**
     * Decodes a response.
     *
     * @param raw the raw response body
     * @param requestedStopCodes stop codes of the request; every one of them is a key of the result
     * @return visits and delivery errors of the response
     * @throws SchemaException when the response does not have the expected envelope
     */
    public AggregatedResponse decode(String raw, Collection<String> requestedStopCodes) {
        JsonNode document = reader.read(raw);

        JsonNode answer;
        String ns;
        if (document.has("Siri")) {
            answer = document.path("Siri").path("ServiceDelivery");
            ns = "";
        } else {
            JsonNode response = document.path("S:Envelope").path("S:Body").path("ns7:GetStopMonitoringServiceResponse");
            if (!response.isObject()) {
                throw schemaError("Missing GetStopMonitoringServiceResponse in stop-monitoring response", raw);
            }
            ns = discoverPrefix(response);
            answer = response.path("Answer");
        }
        if (!answer.isObject()) {
            throw schemaError("Missing Answer in stop-monitoring response", raw);
        }

        JsonNode responseTimestamp = answer.get(ns + "ResponseTimestamp");
        JsonNode deliveries = answer.get(ns + "StopMonitoringDelivery");
        if (responseTimestamp == null || deliveries == null) {
            throw schemaError("Missing ResponseTimestamp or StopMonitoringDelivery in stop-monitoring response", raw);
        }

        AggregatedResponse result = new AggregatedResponse(requestedStopCodes, parseTime(text(responseTimestamp)));
        for (JsonNode delivery : listify(deliveries)) {
            if (!"true".equals(text(delivery.get(ns + "Status")))) {
                String description = text(delivery.path(ns + "ErrorCondition").get(ns + "Description"));
                String error = description == null ? "Unknown stop-monitoring error" : description;
                logger.warn("Stop-monitoring delivery failed: {}", error);
                result.addError(error);
                continue;
            }
            for (JsonNode visitNode : listify(delivery.get(ns + "MonitoredStopVisit"))) {
                Visit visit = decodeVisit(visitNode, ns, raw);
                if (!result.addVisit(visit)) {
                    logger.debug("Ignoring visit for unrequested stop {}", visit.getStopCode());
                }
            }
        }
        return result;
    }

    /**
     * Returns the prefix, colon included, bound to the SIRI namespace on {@code response}.
     */
    static String discoverPrefix(JsonNode response) {
        Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("@xmlns:") && SIRI_NAMESPACE_URI.equals(field.getValue().asText())) {
                return field.getKey().substring("@xmlns:".length()) + ":";
            }
        }
        return DEFAULT_PREFIX;
    }

    /**
     * Wraps a scalar field in a list. A missing or null field gives an empty list.
     */
    static List<JsonNode> listify(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(out::add);
        } else {
            out.add(node);
        }
        return out;
    }

    private Visit decodeVisit(JsonNode src, String ns, String raw) {
        String stopCode = text(src.get(ns + "MonitoringRef"));
        if (stopCode == null) {
            throw schemaError("MonitoredStopVisit without MonitoringRef", raw);
        }
        JsonNode journey = src.path(ns + "MonitoredVehicleJourney");
        JsonNode call = journey.path(ns + "MonitoredCall");

        String tripId = null;
        JsonNode journeyRef = journey.get(ns + "FramedVehicleJourneyRef");
        if (journeyRef != null && journeyRef.isObject()) {
            String dataFrame = text(journeyRef.get(ns + "DataFrameRef"));
            String datedJourney = text(journeyRef.get(ns + "DatedVehicleJourneyRef"));
            if (dataFrame != null && datedJourney != null) {
                tripId = datedJourney + "_" + parseDate(dataFrame).format(TRIP_DATE);
            }
        }

        OffsetDateTime departed = parseTime(text(call.get(ns + "AimedDepartureTime")));
        if (departed == null) {
            departed = parseTime(text(journey.get(ns + "OriginAimedDepartureTime")));
        }

        Location location = null;
        JsonNode vehicleLocation = journey.get(ns + "VehicleLocation");
        if (vehicleLocation != null && vehicleLocation.isObject()) {
            String lat = text(vehicleLocation.get(ns + "Latitude"));
            String lon = text(vehicleLocation.get(ns + "Longitude"));
            if (lat != null && lon != null) {
                try {
                    location = new Location(Double.parseDouble(lat), Double.parseDouble(lon));
                } catch (NumberFormatException e) {
                    throw new SchemaException("Invalid vehicle location " + lat + "," + lon, e);
                }
            }
        }

        return Visit.builder(Visit.PRODUCER_SIRI)
            .timestamp(parseTime(text(src.get(ns + "RecordedAtTime"))))
            .stopCode(stopCode)
            .routeId(text(journey.get(ns + "LineRef")))
            .directionId(text(journey.get(ns + "DirectionRef")))
            .lineName(text(journey.get(ns + "PublishedLineName")))
            .operatorId(text(journey.get(ns + "OperatorRef")))
            .destinationId(text(journey.get(ns + "DestinationRef")))
            .vehicleRef(text(journey.get(ns + "VehicleRef")))
            .tripId(tripId)
            .eta(parseTime(text(call.get(ns + "ExpectedArrivalTime"))))
            .departed(departed)
            .status(text(call.get(ns + "ArrivalStatus")))
            .location(location)
            .raw(src)
            .build();
    }

    /**
     * Text of a leaf field. Elements that carried attributes keep their text under {@code #text},
     * JSON objects under {@code value}.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            JsonNode inner = node.has("#text") ? node.get("#text") : node.get("value");
            return inner == null ? null : inner.asText();
        }
        return node.asText();
    }

    private OffsetDateTime parseTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = TIMESTAMP.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return (OffsetDateTime) parsed;
            }
            return ((LocalDateTime) parsed).atZone(zone()).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            throw new SchemaException("Invalid timestamp " + value, e);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new SchemaException("Invalid DataFrameRef " + value, e);
        }
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private static SchemaException schemaError(String message, String raw) {
        logger.error("{}, raw payload: {}", message, raw);
        return new SchemaException(message);
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
