package sp.sistemaspalacios.api_attendance.dto.event;

/**
 * Marcación tal como llega de una de las rutas de ingreso, antes de normalizar.
 *
 * @see DirectTap
 * @see MirrorDateKeyed
 * @see MirrorFlattened
 */
public interface RawTapEvent {

    String getTagId();
}
