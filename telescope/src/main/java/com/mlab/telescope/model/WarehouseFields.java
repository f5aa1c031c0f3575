package com.mlab.telescope.model;

import java.util.List;

/**
 * Column names of the NDT tables, in the dotted form used in query text.
 *
 * Legacy SQL flattens nested records in result sets, so the same column comes
 * back as e.g. "web100_log_entry_snap_State". Use {@link #resultColumn(String)}
 * to go from one to the other.
 */
public final class WarehouseFields {

    public static final String LOG_TIME = "web100_log_entry.log_time";
    public static final String DATA_DIRECTION = "connection_spec.data_direction";
    public static final String STATE = "web100_log_entry.snap.State";

    public static final String IS_LAST_ENTRY = "web100_log_entry.is_last_entry";
    public static final String REMOTE_IP = "web100_log_entry.connection_spec.remote_ip";
    public static final String LOCAL_IP = "web100_log_entry.connection_spec.local_ip";
    public static final String CLIENT_COUNTRY = "connection_spec.client_geolocation.country_code";

    // ── Server-to-client ────────────────────────────────────────────────────
    public static final String OCTETS_ACKED = "web100_log_entry.snap.HCThruOctetsAcked";
    public static final String SND_LIM_TIME_RWIN = "web100_log_entry.snap.SndLimTimeRwin";
    public static final String SND_LIM_TIME_CWND = "web100_log_entry.snap.SndLimTimeCwnd";
    public static final String SND_LIM_TIME_SND = "web100_log_entry.snap.SndLimTimeSnd";
    public static final String CONG_SIGNALS = "web100_log_entry.snap.CongSignals";

    // ── Client-to-server ────────────────────────────────────────────────────
    public static final String OCTETS_RECEIVED = "web100_log_entry.snap.HCThruOctetsReceived";
    public static final String DURATION = "web100_log_entry.snap.Duration";

    // ── Metric specific ─────────────────────────────────────────────────────
    public static final String MIN_RTT = "web100_log_entry.snap.MinRTT";
    public static final String SUM_RTT = "web100_log_entry.snap.SumRTT";
    public static final String COUNT_RTT = "web100_log_entry.snap.CountRTT";
    public static final String SEGS_RETRANS = "web100_log_entry.snap.SegsRetrans";
    public static final String DATA_SEGS_OUT = "web100_log_entry.snap.DataSegsOut";

    public static final List<String> COMMON = List.of(LOG_TIME, DATA_DIRECTION, STATE);

    public static final List<String> SERVER_TO_CLIENT = List.of(
            OCTETS_ACKED, SND_LIM_TIME_RWIN, SND_LIM_TIME_CWND, SND_LIM_TIME_SND, CONG_SIGNALS);

    public static final List<String> CLIENT_TO_SERVER = List.of(OCTETS_RECEIVED, DURATION);

    private WarehouseFields() {
    }

    public static String resultColumn(String field) {
        return field.replace('.', '_');
    }
}
