package com.questrail.hostbridge.sim;

import com.questrail.hostbridge.api.HostApi;
import com.questrail.hostbridge.api.HostException;
import com.questrail.hostbridge.command.CommandKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SimulatedSessionHost
 * =============================================================================
 * In-memory stand-in for a live music session, enough to drive the bridge
 * end to end without the real application.
 *
 * <p>The session holds a tempo, a playback flag and a list of tracks. Each
 * track has mixer state, devices with parameters, and a fixed row of clip
 * slots. Only a subset of {@link CommandKind} is served; anything else fails
 * with {@code Unsupported command}.</p>
 *
 * <h2>Threading</h2>
 * Not thread-safe. Like the real host it must only be called from the
 * execution serializer thread.
 */
public final class SimulatedSessionHost implements HostApi
{
    public static final int CLIP_SLOTS_PER_TRACK = 8;

    private static final double MIN_TEMPO = 20.0;
    private static final double MAX_TEMPO = 999.0;

    private double tempo = 120.0;
    private int signatureNumerator = 4;
    private int signatureDenominator = 4;
    private boolean playing;
    private final List<Track> tracks = new ArrayList<>();

    /**
     * An empty session: no tracks, 120 BPM, stopped.
     */
    public SimulatedSessionHost()
    {
    }

    /**
     * A small session with one MIDI track (an instrument and a clip in the
     * first slot) and one audio track.
     */
    public static SimulatedSessionHost withDemoSession()
    {
        SimulatedSessionHost host = new SimulatedSessionHost();

        Track midi = host.insertTrack(-1, true);
        midi.name = "Bass";
        Device synth = new Device("Analog", "InstrumentVector");
        synth.parameters.add(new Parameter("Device On", 1.0, 0.0, 1.0, true));
        synth.parameters.add(new Parameter("Filter Freq", 0.5, 0.0, 1.0, false));
        synth.parameters.add(new Parameter("Filter Res", 0.2, 0.0, 1.0, false));
        midi.devices.add(synth);
        midi.clipSlots.set(0, new Clip("Bassline", 4.0));

        Track audio = host.insertTrack(-1, false);
        audio.name = "Drums";

        return host;
    }

    @Override
    public Map<String, Object> invoke(CommandKind kind, Map<String, Object> parameters) throws HostException
    {
        Objects.requireNonNull(kind, "kind");
        Params p = new Params(parameters != null ? parameters : Map.of());

        switch (kind) {
            case GET_SESSION_INFO:
                return sessionInfo();
            case GET_TRACK_INFO:
                return trackInfo(p.intValue("track_index", 0));
            case GET_ALL_TRACKS:
                return allTracks();
            case SET_TEMPO:
                return setTempo(p.doubleValue("tempo", 120.0));
            case SET_TRACK_NAME: {
                int index = p.intValue("track_index", 0);
                Track track = track(index);
                track.name = p.stringValue("name", "");
                return result("name", track.name);
            }
            case SET_TRACK_VOLUME: {
                int index = p.intValue("track_index", 0);
                double volume = p.doubleValue("volume", 0.75);
                Track track = track(index);
                if (volume < 0.0 || volume > 1.0) {
                    throw new HostException("Volume out of range");
                }
                track.volume = volume;
                return result("track_name", track.name, "volume", volume);
            }
            case SET_TRACK_PAN: {
                int index = p.intValue("track_index", 0);
                double pan = p.doubleValue("pan", 0.0);
                Track track = track(index);
                track.pan = Math.max(-1.0, Math.min(1.0, pan));
                return result("track_index", index, "pan", pan);
            }
            case SET_TRACK_MUTE: {
                Track track = track(p.intValue("track_index", 0));
                track.mute = p.booleanValue("mute", false);
                return result("track_name", track.name, "mute", track.mute);
            }
            case SET_TRACK_SOLO: {
                Track track = track(p.intValue("track_index", 0));
                track.solo = p.booleanValue("solo", false);
                return result("track_name", track.name, "solo", track.solo);
            }
            case SET_TRACK_ARM: {
                Track track = track(p.intValue("track_index", 0));
                track.arm = p.booleanValue("arm", false);
                return result("track_name", track.name, "arm", track.arm);
            }
            case GET_DEVICE_PARAMETERS:
                return deviceParameters(p.intValue("track_index", 0), p.intValue("device_index", 0));
            case SET_DEVICE_PARAMETER:
                return setDeviceParameter(
                        p.intValue("track_index", 0),
                        p.intValue("device_index", 0),
                        p.intValue("parameter_index", 0),
                        p.doubleValue("value", 0.0));
            case CREATE_MIDI_TRACK:
                return createTrack(p.intValue("index", -1), true);
            case CREATE_AUDIO_TRACK:
                return createTrack(p.intValue("index", -1), false);
            case DELETE_TRACK: {
                int index = p.intValue("track_index", 0);
                Track removed = track(index);
                tracks.remove(index);
                return result("deleted_index", index, "deleted_track", removed.name);
            }
            case DELETE_ALL_TRACKS: {
                int count = tracks.size();
                tracks.clear();
                return result("deleted_count", count);
            }
            case FIRE_CLIP:
                return fireClip(p.intValue("track_index", 0), p.intValue("clip_index", 0));
            case STOP_CLIP:
                return stopClip(p.intValue("track_index", 0), p.intValue("clip_index", 0));
            case START_PLAYBACK:
                playing = true;
                return result("playing", true);
            case STOP_PLAYBACK:
                playing = false;
                for (Track t : tracks) {
                    for (Clip clip : t.clipSlots) {
                        if (clip != null) {
                            clip.playing = false;
                        }
                    }
                }
                return result("playing", false);
            default:
                throw new HostException("Unsupported command: " + kind.wireName());
        }
    }

    public double tempo()
    {
        return tempo;
    }

    public boolean isPlaying()
    {
        return playing;
    }

    public int trackCount()
    {
        return tracks.size();
    }

    // -------------------------------------------------------------------------
    // Operations
    // -------------------------------------------------------------------------

    private Map<String, Object> sessionInfo()
    {
        return result(
                "tempo", tempo,
                "signature_numerator", signatureNumerator,
                "signature_denominator", signatureDenominator,
                "track_count", tracks.size(),
                "return_track_count", 0,
                "is_playing", playing);
    }

    private Map<String, Object> trackInfo(int index) throws HostException
    {
        Track track = track(index);

        List<Map<String, Object>> slots = new ArrayList<>();
        for (int i = 0; i < track.clipSlots.size(); i++) {
            Clip clip = track.clipSlots.get(i);
            Map<String, Object> slot = new LinkedHashMap<>();
            slot.put("index", i);
            slot.put("has_clip", clip != null);
            slot.put("clip", clip == null ? null : result(
                    "name", clip.name,
                    "length", clip.length,
                    "is_playing", clip.playing,
                    "is_recording", false));
            slots.add(slot);
        }

        List<Map<String, Object>> devices = new ArrayList<>();
        for (int i = 0; i < track.devices.size(); i++) {
            Device device = track.devices.get(i);
            devices.add(result("index", i, "name", device.name, "class_name", device.className));
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("index", index);
        info.put("name", track.name);
        info.put("is_audio_track", !track.midi);
        info.put("is_midi_track", track.midi);
        info.put("mute", track.mute);
        info.put("solo", track.solo);
        info.put("arm", track.arm);
        info.put("volume", track.volume);
        info.put("panning", track.pan);
        info.put("clip_slots", slots);
        info.put("devices", devices);
        return info;
    }

    private Map<String, Object> allTracks()
    {
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            Track track = tracks.get(i);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("index", i);
            summary.put("name", track.name);
            summary.put("is_audio", !track.midi);
            summary.put("is_midi", track.midi);
            summary.put("mute", track.mute);
            summary.put("solo", track.solo);
            summary.put("arm", track.arm);
            summaries.add(summary);
        }
        return result("tracks", summaries, "count", summaries.size());
    }

    private Map<String, Object> setTempo(double value) throws HostException
    {
        if (value < MIN_TEMPO || value > MAX_TEMPO) {
            throw new HostException("Tempo out of range");
        }
        tempo = value;
        return result("tempo", tempo);
    }

    private Map<String, Object> deviceParameters(int trackIndex, int deviceIndex) throws HostException
    {
        Device device = device(track(trackIndex), deviceIndex);

        List<Map<String, Object>> parameters = new ArrayList<>();
        for (int i = 0; i < device.parameters.size(); i++) {
            Parameter parameter = device.parameters.get(i);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", i);
            entry.put("name", parameter.name);
            entry.put("value", parameter.value);
            entry.put("min", parameter.min);
            entry.put("max", parameter.max);
            entry.put("is_quantized", parameter.quantized);
            parameters.add(entry);
        }
        return result("device_name", device.name, "device_index", deviceIndex, "parameters", parameters);
    }

    private Map<String, Object> setDeviceParameter(int trackIndex, int deviceIndex, int parameterIndex, double value)
            throws HostException
    {
        Device device = device(track(trackIndex), deviceIndex);
        if (parameterIndex < 0 || parameterIndex >= device.parameters.size()) {
            throw new HostException("Parameter index out of range");
        }
        Parameter parameter = device.parameters.get(parameterIndex);
        if (value < parameter.min || value > parameter.max) {
            throw new HostException("Parameter value out of range");
        }
        parameter.value = value;
        return result(
                "device_name", device.name,
                "parameter_index", parameterIndex,
                "parameter_name", parameter.name,
                "value", value);
    }

    private Map<String, Object> fireClip(int trackIndex, int clipIndex) throws HostException
    {
        Track track = track(trackIndex);
        Clip clip = clip(track, clipIndex);
        if (clip == null) {
            throw new HostException("No clip in slot");
        }
        // One playing clip per track.
        for (Clip other : track.clipSlots) {
            if (other != null) {
                other.playing = false;
            }
        }
        clip.playing = true;
        playing = true;
        return result("fired", true);
    }

    private Map<String, Object> stopClip(int trackIndex, int clipIndex) throws HostException
    {
        Clip clip = clip(track(trackIndex), clipIndex);
        if (clip != null) {
            clip.playing = false;
        }
        return result("stopped", true);
    }

    private Map<String, Object> createTrack(int index, boolean midi) throws HostException
    {
        if (index < -1 || index > tracks.size()) {
            throw new HostException("Track index out of range");
        }
        Track track = insertTrack(index, midi);
        return result("index", tracks.indexOf(track), "name", track.name);
    }

    // -------------------------------------------------------------------------
    // Session model
    // -------------------------------------------------------------------------

    private Track insertTrack(int index, boolean midi)
    {
        int position = index == -1 ? tracks.size() : index;
        Track track = new Track((position + 1) + (midi ? "-MIDI" : "-Audio"), midi);
        tracks.add(position, track);
        return track;
    }

    private Track track(int index) throws HostException
    {
        if (index < 0 || index >= tracks.size()) {
            throw new HostException("Track index out of range");
        }
        return tracks.get(index);
    }

    private static Device device(Track track, int index) throws HostException
    {
        if (index < 0 || index >= track.devices.size()) {
            throw new HostException("Device index out of range");
        }
        return track.devices.get(index);
    }

    private static Clip clip(Track track, int index) throws HostException
    {
        if (index < 0 || index >= track.clipSlots.size()) {
            throw new HostException("Clip index out of range");
        }
        return track.clipSlots.get(index);
    }

    private static Map<String, Object> result(Object... keyValues)
    {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.put((String) keyValues[i], keyValues[i + 1]);
        }
        return result;
    }

    private static final class Track
    {
        private String name;
        private final boolean midi;
        private double volume = 0.85;
        private double pan;
        private boolean mute;
        private boolean solo;
        private boolean arm;
        private final List<Device> devices = new ArrayList<>();
        private final List<Clip> clipSlots = new ArrayList<>();

        Track(String name, boolean midi)
        {
            this.name = name;
            this.midi = midi;
            for (int i = 0; i < CLIP_SLOTS_PER_TRACK; i++) {
                clipSlots.add(null);
            }
        }
    }

    private static final class Device
    {
        private final String name;
        private final String className;
        private final List<Parameter> parameters = new ArrayList<>();

        Device(String name, String className)
        {
            this.name = name;
            this.className = className;
        }
    }

    private static final class Parameter
    {
        private final String name;
        private double value;
        private final double min;
        private final double max;
        private final boolean quantized;

        Parameter(String name, double value, double min, double max, boolean quantized)
        {
            this.name = name;
            this.value = value;
            this.min = min;
            this.max = max;
            this.quantized = quantized;
        }
    }

    private static final class Clip
    {
        private final String name;
        private final double length;
        private boolean playing;

        Clip(String name, double length)
        {
            this.name = name;
            this.length = length;
        }
    }

    /**
     * Typed access to loosely-typed JSON parameters.
     */
    private static final class Params
    {
        private final Map<String, Object> values;

        Params(Map<String, Object> values)
        {
            this.values = values;
        }

        int intValue(String key, int fallback) throws HostException
        {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Number number) {
                double d = number.doubleValue();
                if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                    return number.intValue();
                }
            }
            throw invalid(key, value);
        }

        double doubleValue(String key, double fallback) throws HostException
        {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            throw invalid(key, value);
        }

        boolean booleanValue(String key, boolean fallback) throws HostException
        {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof Boolean flag) {
                return flag;
            }
            throw invalid(key, value);
        }

        String stringValue(String key, String fallback) throws HostException
        {
            Object value = values.get(key);
            if (value == null) {
                return fallback;
            }
            if (value instanceof String text) {
                return text;
            }
            throw invalid(key, value);
        }

        private static HostException invalid(String key, Object value)
        {
            return new HostException("Invalid parameter '" + key + "': " + value);
        }
    }
}
