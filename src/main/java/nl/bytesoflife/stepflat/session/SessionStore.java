package nl.bytesoflife.stepflat.session;

import java.util.Optional;

/**
 * Keeps uploaded face sets between requests.
 */
public interface SessionStore {

    void insert(FaceSession session);

    Optional<FaceSession> get(String sessionId);

    /**
     * @throws SessionNotFoundException when no live session has this id
     */
    default FaceSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    boolean remove(String sessionId);

    int size();
}
