package com.questrail.hostbridge.command;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CommandKind
 * =============================================================================
 * Closed set of host operations the bridge knows how to route.
 *
 * <p>Inbound messages name a command with a free-form string ({@code "type"} on
 * the wire). That string is resolved to a {@code CommandKind} at classification
 * time; anything outside this enum is rejected before it can reach the
 * execution serializer.</p>
 *
 * <p>Transport eligibility and criticality are not properties of the kind
 * itself; they live in {@link CommandClassifier}.</p>
 */
public enum CommandKind
{
    // Reads
    GET_SESSION_INFO("get_session_info"),
    GET_TRACK_INFO("get_track_info"),
    GET_DEVICE_PARAMETERS("get_device_parameters"),
    GET_PLAYHEAD_POSITION("get_playhead_position"),
    GET_CLIP_NOTES("get_clip_notes"),
    GET_CLIP_FOLLOW_ACTIONS("get_clip_follow_actions"),
    GET_MASTER_TRACK_INFO("get_master_track_info"),
    GET_RETURN_TRACKS("get_return_tracks"),
    GET_ALL_TRACKS("get_all_tracks"),
    GET_ALL_SCENES("get_all_scenes"),
    GET_SESSION_OVERVIEW("get_session_overview"),
    GET_ALL_CLIPS_IN_TRACK("get_all_clips_in_track"),
    GET_CLIP_ENVELOPES("get_clip_envelopes"),
    GET_CLIP_WARP_MARKERS("get_clip_warp_markers"),
    GET_BROWSER_ITEM("get_browser_item"),
    GET_BROWSER_CATEGORIES("get_browser_categories"),
    GET_BROWSER_ITEMS("get_browser_items"),
    GET_BROWSER_TREE("get_browser_tree"),
    GET_BROWSER_ITEMS_AT_PATH("get_browser_items_at_path"),

    // High-frequency, overwritable controls
    SET_DEVICE_PARAMETER("set_device_parameter"),
    SET_TRACK_VOLUME("set_track_volume"),
    SET_TRACK_PAN("set_track_pan"),
    SET_TRACK_MUTE("set_track_mute"),
    SET_TRACK_SOLO("set_track_solo"),
    SET_TRACK_ARM("set_track_arm"),
    SET_CLIP_LAUNCH_MODE("set_clip_launch_mode"),
    FIRE_CLIP("fire_clip"),

    // Overwritable, low-frequency setters and transport toggles
    SET_TRACK_NAME("set_track_name"),
    SET_TRACK_COLOR("set_track_color"),
    SET_TRACK_FOLD("set_track_fold"),
    SET_CLIP_NAME("set_clip_name"),
    SET_CLIP_LOOP("set_clip_loop"),
    SET_CLIP_FOLLOW_ACTION("set_clip_follow_action"),
    SET_SCENE_NAME("set_scene_name"),
    SET_TEMPO("set_tempo"),
    SET_TIME_SIGNATURE("set_time_signature"),
    SET_METRONOME("set_metronome"),
    SET_MASTER_VOLUME("set_master_volume"),
    SET_SEND_AMOUNT("set_send_amount"),
    SET_TRACK_MONITORING_STATE("set_track_monitoring_state"),
    SET_PLAYHEAD_POSITION("set_playhead_position"),
    SET_LOOP("set_loop"),
    SET_NOTE_VELOCITY("set_note_velocity"),
    SET_NOTE_DURATION("set_note_duration"),
    SET_NOTE_PITCH("set_note_pitch"),
    SET_CLIP_WARP_MODE("set_clip_warp_mode"),
    TOGGLE_DEVICE_BYPASS("toggle_device_bypass"),
    STOP_CLIP("stop_clip"),
    FIRE_SCENE("fire_scene"),
    START_PLAYBACK("start_playback"),
    STOP_PLAYBACK("stop_playback"),
    JUMP_TO_LOCATOR("jump_to_locator"),

    // Structural and destructive edits
    CREATE_MIDI_TRACK("create_midi_track"),
    CREATE_AUDIO_TRACK("create_audio_track"),
    DELETE_ALL_TRACKS("delete_all_tracks"),
    DELETE_TRACK("delete_track"),
    DUPLICATE_TRACK("duplicate_track"),
    CREATE_CLIP("create_clip"),
    DELETE_CLIP("delete_clip"),
    DUPLICATE_CLIP("duplicate_clip"),
    MOVE_CLIP("move_clip"),
    ADD_NOTES_TO_CLIP("add_notes_to_clip"),
    DELETE_NOTES_FROM_CLIP("delete_notes_from_clip"),
    QUANTIZE_CLIP("quantize_clip"),
    TRANSPOSE_CLIP("transpose_clip"),
    CREATE_SCENE("create_scene"),
    DELETE_SCENE("delete_scene"),
    DUPLICATE_SCENE("duplicate_scene"),
    START_RECORDING("start_recording"),
    STOP_RECORDING("stop_recording"),
    LOAD_BROWSER_ITEM("load_browser_item"),
    LOAD_INSTRUMENT_OR_EFFECT("load_instrument_or_effect"),
    LOAD_INSTRUMENT_PRESET("load_instrument_preset"),
    ADD_AUTOMATION_POINT("add_automation_point"),
    CLEAR_AUTOMATION("clear_automation"),
    DUPLICATE_DEVICE("duplicate_device"),
    DELETE_DEVICE("delete_device"),
    MOVE_DEVICE("move_device"),
    UNDO("undo"),
    REDO("redo"),
    CREATE_LOCATOR("create_locator"),
    DELETE_LOCATOR("delete_locator"),
    MIX_CLIP("mix_clip"),
    STRETCH_CLIP("stretch_clip"),
    CROP_CLIP("crop_clip"),
    RESIZE_CLIP("resize_clip"),
    DUPLICATE_CLIP_TO("duplicate_clip_to"),
    GROUP_TRACKS("group_tracks"),
    UNGROUP_TRACKS("ungroup_tracks"),
    ADD_WARP_MARKER("add_warp_marker"),
    DELETE_WARP_MARKER("delete_warp_marker"),
    RELOAD_SCRIPT("reload_script");

    private static final Map<String, CommandKind> BY_WIRE_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(CommandKind::wireName, Function.identity())));

    private final String wireName;

    CommandKind(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * The name used for this command in the {@code "type"} field of a request.
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Resolve a wire name. Matching is exact and case-sensitive.
     */
    public static Optional<CommandKind> fromWireName(String wireName)
    {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
