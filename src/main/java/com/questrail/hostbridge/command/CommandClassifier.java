package com.questrail.hostbridge.command;

import com.questrail.hostbridge.api.Transport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CommandClassifier
 * =============================================================================
 * Static policy table mapping a command name to its allowed transports and
 * criticality.
 *
 * <h2>Policy</h2>
 * A command is UDP-eligible only when <em>all</em> of the following hold:
 * <ul>
 *   <li>its effect is overwritten by a later command of the same shape</li>
 *   <li>the caller does not need its return value</li>
 *   <li>its payload is small</li>
 *   <li>it is driven from high-frequency control loops</li>
 * </ul>
 * Everything else is TCP-only. Reads and destructive or structural edits are
 * {@link Criticality#CRITICAL}; overwritable setters that are not worth a lossy
 * channel stay {@link Criticality#REVERSIBLE} but TCP-only.
 *
 * <p>Unknown names resolve to {@link Optional#empty()} and are never upgraded
 * to UDP eligibility.</p>
 *
 * <p>The table is built once and is immutable; {@link #classify(String)} is a
 * pure lookup safe to call from any thread.</p>
 */
public final class CommandClassifier
{
    private static final CommandClassifier DEFAULT = new CommandClassifier();

    private final Map<CommandKind, ClassificationEntry> table;

    private CommandClassifier()
    {
        Map<CommandKind, ClassificationEntry> entries = new EnumMap<>(CommandKind.class);
        for (CommandKind kind : CommandKind.values()) {
            entries.put(kind, entryFor(kind));
        }
        this.table = Collections.unmodifiableMap(entries);
    }

    /**
     * The compiled-in classification table.
     */
    public static CommandClassifier defaultTable()
    {
        return DEFAULT;
    }

    /**
     * Look up a command by its wire name.
     *
     * @return the entry, or empty if the name is not a known command
     */
    public Optional<ClassificationEntry> classify(String commandName)
    {
        return CommandKind.fromWireName(commandName).map(table::get);
    }

    public ClassificationEntry classify(CommandKind kind)
    {
        return table.get(Objects.requireNonNull(kind, "kind"));
    }

    /**
     * All commands that may be sent over the given transport.
     */
    public Set<CommandKind> allowedOver(Transport transport)
    {
        Set<CommandKind> allowed = EnumSet.noneOf(CommandKind.class);
        for (ClassificationEntry entry : table.values()) {
            if (entry.allows(transport)) {
                allowed.add(entry.kind());
            }
        }
        return Collections.unmodifiableSet(allowed);
    }

    private static ClassificationEntry entryFor(CommandKind kind)
    {
        return switch (kind) {
            // Fast controls: the only UDP-eligible commands.
            case SET_DEVICE_PARAMETER, SET_TRACK_VOLUME, SET_TRACK_PAN, SET_TRACK_MUTE,
                 SET_TRACK_SOLO, SET_TRACK_ARM, SET_CLIP_LAUNCH_MODE, FIRE_CLIP ->
                    ClassificationEntry.udpEligible(kind);

            // Overwritable but low-frequency.
            case SET_TRACK_NAME, SET_TRACK_COLOR, SET_TRACK_FOLD, SET_CLIP_NAME, SET_CLIP_LOOP,
                 SET_CLIP_FOLLOW_ACTION, SET_SCENE_NAME, SET_TEMPO, SET_TIME_SIGNATURE,
                 SET_METRONOME, SET_MASTER_VOLUME, SET_SEND_AMOUNT, SET_TRACK_MONITORING_STATE,
                 SET_PLAYHEAD_POSITION, SET_LOOP, SET_NOTE_VELOCITY, SET_NOTE_DURATION,
                 SET_NOTE_PITCH, SET_CLIP_WARP_MODE, TOGGLE_DEVICE_BYPASS, STOP_CLIP, FIRE_SCENE,
                 START_PLAYBACK, STOP_PLAYBACK, JUMP_TO_LOCATOR ->
                    ClassificationEntry.tcpOnly(kind, Criticality.REVERSIBLE);

            // Result-bearing reads.
            case GET_SESSION_INFO, GET_TRACK_INFO, GET_DEVICE_PARAMETERS, GET_PLAYHEAD_POSITION,
                 GET_CLIP_NOTES, GET_CLIP_FOLLOW_ACTIONS, GET_MASTER_TRACK_INFO, GET_RETURN_TRACKS,
                 GET_ALL_TRACKS, GET_ALL_SCENES, GET_SESSION_OVERVIEW, GET_ALL_CLIPS_IN_TRACK,
                 GET_CLIP_ENVELOPES, GET_CLIP_WARP_MARKERS, GET_BROWSER_ITEM, GET_BROWSER_CATEGORIES,
                 GET_BROWSER_ITEMS, GET_BROWSER_TREE, GET_BROWSER_ITEMS_AT_PATH ->
                    ClassificationEntry.tcpOnly(kind, Criticality.CRITICAL);

            // Structural, destructive, or durable-state edits.
            case CREATE_MIDI_TRACK, CREATE_AUDIO_TRACK, DELETE_ALL_TRACKS, DELETE_TRACK,
                 DUPLICATE_TRACK, CREATE_CLIP, DELETE_CLIP, DUPLICATE_CLIP, MOVE_CLIP,
                 ADD_NOTES_TO_CLIP, DELETE_NOTES_FROM_CLIP, QUANTIZE_CLIP, TRANSPOSE_CLIP,
                 CREATE_SCENE, DELETE_SCENE, DUPLICATE_SCENE, START_RECORDING, STOP_RECORDING,
                 LOAD_BROWSER_ITEM, LOAD_INSTRUMENT_OR_EFFECT, LOAD_INSTRUMENT_PRESET,
                 ADD_AUTOMATION_POINT, CLEAR_AUTOMATION, DUPLICATE_DEVICE, DELETE_DEVICE,
                 MOVE_DEVICE, UNDO, REDO, CREATE_LOCATOR, DELETE_LOCATOR, MIX_CLIP, STRETCH_CLIP,
                 CROP_CLIP, RESIZE_CLIP, DUPLICATE_CLIP_TO, GROUP_TRACKS, UNGROUP_TRACKS,
                 ADD_WARP_MARKER, DELETE_WARP_MARKER, RELOAD_SCRIPT ->
                    ClassificationEntry.tcpOnly(kind, Criticality.CRITICAL);
        };
    }
}
